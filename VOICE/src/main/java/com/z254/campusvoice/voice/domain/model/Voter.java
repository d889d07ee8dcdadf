package com.z254.campusvoice.voice.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Student profile keyed by roll number.
 * <p>
 * Voters first seen through a vote have only an id until they submit a
 * complaint with their details.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Voter {

    /** Roll number */
    private String id;

    private String name;

    private String email;

    private String department;

    /** Hostel or Day Scholar */
    private String stayType;

    private Instant createdAt;

    private Instant updatedAt;

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public Voter copy() {
        return toBuilder().build();
    }
}

package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.testing.fixtures.CampusTestData;
import com.z254.campusvoice.voice.domain.model.Classification;
import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.Priority;
import com.z254.campusvoice.voice.scoring.PriorityScore;
import com.z254.campusvoice.voice.scoring.PriorityScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryComplaintRepository}.
 */
class InMemoryComplaintRepositoryTest {

    private static final String COMPLAINT_ID = "c-1";

    private InMemoryComplaintRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryComplaintRepository();
        String title = CampusTestData.complaintTitle();
        repository.save(Complaint.builder()
                .id(COMPLAINT_ID)
                .title(title)
                .description(CampusTestData.complaintDescription(title))
                .priority(Priority.MEDIUM)
                .priorityScore(400)
                .classification(Classification.fallback())
                .submitterId(CampusTestData.rollNumber())
                .submittedAt(Instant.now())
                .updatedAt(Instant.now())
                .build());
    }

    private Classification storedClassification() {
        return repository.findById(COMPLAINT_ID).orElseThrow().getClassification();
    }

    @Test
    @DisplayName("editing a read classification leaves the stored one untouched")
    void readCopyIsDetached() {
        Classification read = storedClassification();
        read.setPriority("critical");
        read.setUrgencyScore(100);
        read.getKeyIssues().add("Injected issue");

        Classification stored = storedClassification();
        assertThat(stored.getPriority()).isEqualTo("medium");
        assertThat(stored.getUrgencyScore()).isEqualTo(50);
        assertThat(stored.getKeyIssues()).containsExactly("Manual review required");
        assertThat(new PriorityScorer().score(stored, 0, 0))
                .isEqualTo(new PriorityScore(400, Priority.MEDIUM));
    }

    @Test
    @DisplayName("editing a saved instance after save leaves the stored one untouched")
    void savedInstanceIsDetached() {
        Complaint complaint = repository.findById(COMPLAINT_ID).orElseThrow();
        repository.save(complaint);

        complaint.getClassification().setCategory("food");
        complaint.getClassification().getKeyIssues().clear();
        complaint.setUpvotes(99);

        Complaint stored = repository.findById(COMPLAINT_ID).orElseThrow();
        assertThat(stored.getClassification().getCategory()).isEqualTo("other");
        assertThat(stored.getClassification().getKeyIssues()).hasSize(1);
        assertThat(stored.getUpvotes()).isZero();
    }

    @Test
    @DisplayName("listing hands out detached copies")
    void findAllCopiesAreDetached() {
        repository.findAll().forEach(c -> c.getClassification().setSummary("rewritten"));

        assertThat(storedClassification().getSummary()).isEqualTo(Classification.FALLBACK_SUMMARY);
    }
}

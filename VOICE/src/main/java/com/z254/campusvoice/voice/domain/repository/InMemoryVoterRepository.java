package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.model.Voter;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
public class InMemoryVoterRepository implements VoterRepository {

    private final ConcurrentMap<String, Voter> store = new ConcurrentHashMap<>();

    @Override
    public Voter upsert(Voter profile) {
        Instant now = Instant.now();
        return store.compute(profile.getId(), (id, existing) -> {
            if (existing == null) {
                return profile.toBuilder().createdAt(now).updatedAt(now).build();
            }
            return existing.toBuilder()
                    .name(firstNonNull(profile.getName(), existing.getName()))
                    .email(firstNonNull(profile.getEmail(), existing.getEmail()))
                    .department(firstNonNull(profile.getDepartment(), existing.getDepartment()))
                    .stayType(firstNonNull(profile.getStayType(), existing.getStayType()))
                    .updatedAt(now)
                    .build();
        }).copy();
    }

    @Override
    public Voter registerIfAbsent(String voterId) {
        return store.computeIfAbsent(voterId, id -> {
            Instant now = Instant.now();
            return Voter.builder().id(id).createdAt(now).updatedAt(now).build();
        }).copy();
    }

    @Override
    public Optional<Voter> findById(String voterId) {
        return Optional.ofNullable(store.get(voterId)).map(Voter::copy);
    }

    @Override
    public long count() {
        return store.size();
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }
}

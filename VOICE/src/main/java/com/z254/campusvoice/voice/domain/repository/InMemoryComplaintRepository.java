package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.model.Complaint;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory complaint store. Copies on the way in and out so callers
 * can only change stored state through {@link #save}.
 */
@Repository
public class InMemoryComplaintRepository implements ComplaintRepository {

    private final Map<String, Complaint> store = new ConcurrentHashMap<>();

    @Override
    public Complaint save(Complaint complaint) {
        store.put(complaint.getId(), complaint.copy());
        return complaint;
    }

    @Override
    public Optional<Complaint> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(Complaint::copy);
    }

    @Override
    public List<Complaint> findAll() {
        return store.values().stream().map(Complaint::copy).toList();
    }

    @Override
    public long count() {
        return store.size();
    }
}

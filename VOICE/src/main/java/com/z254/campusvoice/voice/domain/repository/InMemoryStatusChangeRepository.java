package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.model.StatusChange;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryStatusChangeRepository implements StatusChangeRepository {

    private final Map<String, List<StatusChange>> store = new ConcurrentHashMap<>();

    @Override
    public StatusChange append(StatusChange change) {
        store.computeIfAbsent(change.getComplaintId(), id -> new CopyOnWriteArrayList<>()).add(change);
        return change;
    }

    @Override
    public List<StatusChange> findByComplaint(String complaintId) {
        return List.copyOf(store.getOrDefault(complaintId, List.of()));
    }

    @Override
    public long count() {
        return store.values().stream().mapToLong(List::size).sum();
    }
}

package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.exception.DuplicateVoteException;
import com.z254.campusvoice.voice.domain.model.Vote;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryVoteRepository implements VoteRepository {

    // complaintId -> voterId -> vote
    private final Map<String, Map<String, Vote>> store = new ConcurrentHashMap<>();

    @Override
    public Vote insert(Vote vote) {
        Vote previous = votesFor(vote.getComplaintId()).putIfAbsent(vote.getVoterId(), vote.copy());
        if (previous != null) {
            throw new DuplicateVoteException(vote.getComplaintId(), vote.getVoterId());
        }
        return vote;
    }

    @Override
    public Vote update(Vote vote) {
        votesFor(vote.getComplaintId()).put(vote.getVoterId(), vote.copy());
        return vote;
    }

    @Override
    public void delete(String complaintId, String voterId) {
        Map<String, Vote> votes = store.get(complaintId);
        if (votes != null) {
            votes.remove(voterId);
        }
    }

    @Override
    public Optional<Vote> find(String complaintId, String voterId) {
        Map<String, Vote> votes = store.get(complaintId);
        if (votes == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(votes.get(voterId)).map(Vote::copy);
    }

    @Override
    public List<Vote> findByComplaint(String complaintId) {
        Map<String, Vote> votes = store.get(complaintId);
        if (votes == null) {
            return List.of();
        }
        return votes.values().stream()
                .map(Vote::copy)
                .sorted(Comparator.comparing(Vote::getCreatedAt))
                .toList();
    }

    @Override
    public long count() {
        return store.values().stream().mapToLong(Map::size).sum();
    }

    private Map<String, Vote> votesFor(String complaintId) {
        return store.computeIfAbsent(complaintId, id -> new ConcurrentHashMap<>());
    }
}

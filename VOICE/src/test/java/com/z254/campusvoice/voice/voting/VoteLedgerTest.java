package com.z254.campusvoice.voice.voting;

import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.exception.ComplaintNotFoundException;
import com.z254.campusvoice.voice.domain.exception.DuplicateVoteException;
import com.z254.campusvoice.voice.domain.exception.InvalidInputException;
import com.z254.campusvoice.voice.domain.exception.InvalidVoteTypeException;
import com.z254.campusvoice.voice.domain.exception.PersistenceUnavailableException;
import com.z254.campusvoice.voice.domain.exception.TransientPersistenceException;
import com.z254.campusvoice.voice.domain.exception.VoteConflictException;
import com.z254.campusvoice.voice.domain.model.Classification;
import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.Priority;
import com.z254.campusvoice.voice.domain.model.Vote;
import com.z254.campusvoice.voice.domain.model.VoteType;
import com.z254.campusvoice.voice.domain.model.Voter;
import com.z254.campusvoice.voice.domain.repository.FlakyComplaintRepository;
import com.z254.campusvoice.voice.domain.repository.InMemoryVoteRepository;
import com.z254.campusvoice.voice.domain.repository.InMemoryVoterRepository;
import com.z254.campusvoice.voice.domain.repository.VoteRepository;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger;
import com.z254.campusvoice.voice.persistence.ComplaintLockManager;
import com.z254.campusvoice.voice.persistence.StorageAccess;
import com.z254.campusvoice.voice.realtime.BroadcastRegistry;
import com.z254.campusvoice.voice.realtime.ComplaintFeedPublisher;
import com.z254.campusvoice.voice.realtime.RealtimeEvents;
import com.z254.campusvoice.voice.scoring.PriorityScorer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link VoteLedger}.
 */
@ExtendWith(MockitoExtension.class)
class VoteLedgerTest {

    private static final String COMPLAINT_ID = "c-1";

    @Mock
    private BroadcastRegistry broadcastRegistry;

    private FlakyComplaintRepository complaintRepository;
    private InMemoryVoterRepository voterRepository;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        complaintRepository = new FlakyComplaintRepository();
        voterRepository = new InMemoryVoterRepository();
        meterRegistry = new SimpleMeterRegistry();
        complaintRepository.save(Complaint.builder()
                .id(COMPLAINT_ID)
                .title("Cold food at dinner")
                .description("Dinner has been served cold for a week")
                .priority(Priority.MEDIUM)
                .priorityScore(400)
                .classification(Classification.fallback())
                .submitterId("21CS0001")
                .submittedAt(Instant.now())
                .updatedAt(Instant.now())
                .build());
    }

    private VoteLedger ledger(VoteRepository voteRepository) {
        VoiceProperties properties = new VoiceProperties();
        properties.getPersistence().getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getPersistence().getRetry().setMaxBackoff(Duration.ofMillis(5));
        VoiceMetrics metrics = new VoiceMetrics(meterRegistry);
        VoiceStructuredLogger structuredLogger = new VoiceStructuredLogger();
        return new VoteLedger(complaintRepository, voteRepository, voterRepository, new PriorityScorer(),
                new ComplaintLockManager(), new StorageAccess(properties, metrics),
                new ComplaintFeedPublisher(broadcastRegistry, metrics, structuredLogger),
                metrics, structuredLogger);
    }

    private Complaint stored() {
        return complaintRepository.findById(COMPLAINT_ID).orElseThrow();
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Nested
    @DisplayName("Vote transitions")
    class TransitionTests {

        private InMemoryVoteRepository votes;
        private VoteLedger ledger;

        @BeforeEach
        void setUp() {
            votes = new InMemoryVoteRepository();
            ledger = ledger(votes);
        }

        @Test
        @DisplayName("first vote creates a record and increments the counter")
        void firstVoteCreates() {
            VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");

            assertThat(outcome.getAction()).isEqualTo(VoteAction.CREATED);
            assertThat(outcome.getUpvotes()).isEqualTo(1);
            assertThat(outcome.getDownvotes()).isZero();
            assertThat(outcome.getMessage()).isEqualTo("Upvote added");
            assertThat(votes.find(COMPLAINT_ID, "21CS0002")).map(Vote::getVoteType).contains(VoteType.UPVOTE);
            assertThat(stored().getUpvotes()).isEqualTo(1);
            assertThat(voterRepository.findById("21CS0002")).isPresent();
        }

        @Test
        @DisplayName("repeating the same vote removes it")
        void sameVoteToggles() {
            ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");
            VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");

            assertThat(outcome.getAction()).isEqualTo(VoteAction.DELETED);
            assertThat(outcome.getMessage()).isEqualTo("Upvote removed");
            assertThat(outcome.getUpvotes()).isZero();
            assertThat(votes.find(COMPLAINT_ID, "21CS0002")).isEmpty();
            assertThat(stored().getUpvotes()).isZero();
        }

        @Test
        @DisplayName("opposite vote switches the record")
        void oppositeVoteSwitches() {
            ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");
            VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "21CS0002", "DOWNVOTE");

            assertThat(outcome.getAction()).isEqualTo(VoteAction.UPDATED);
            assertThat(outcome.getMessage()).isEqualTo("Vote changed to downvote");
            assertThat(outcome.getUpvotes()).isZero();
            assertThat(outcome.getDownvotes()).isEqualTo(1);
            assertThat(votes.find(COMPLAINT_ID, "21CS0002")).map(Vote::getVoteType).contains(VoteType.DOWNVOTE);
        }

        @Test
        @DisplayName("counters always match the stored votes")
        void countersMatchVotes() {
            String[][] sequence = {
                    {"a", "upvote"}, {"b", "downvote"}, {"a", "downvote"}, {"c", "upvote"},
                    {"b", "downvote"}, {"c", "upvote"}, {"d", "upvote"}, {"a", "upvote"}
            };
            for (String[] step : sequence) {
                ledger.vote(COMPLAINT_ID, step[0], step[1]);
                Complaint complaint = stored();
                List<Vote> current = votes.findByComplaint(COMPLAINT_ID);
                assertThat(complaint.getUpvotes())
                        .isEqualTo((int) current.stream().filter(v -> v.getVoteType() == VoteType.UPVOTE).count());
                assertThat(complaint.getDownvotes())
                        .isEqualTo((int) current.stream().filter(v -> v.getVoteType() == VoteType.DOWNVOTE).count());
                assertThat(complaint.getUpvotes()).isNotNegative();
                assertThat(complaint.getDownvotes()).isNotNegative();
            }
            assertThat(stored().getUpvotes()).isEqualTo(2);
            assertThat(stored().getDownvotes()).isZero();
        }

        @Test
        @DisplayName("each vote is broadcast to the complaint's feed")
        void voteIsBroadcast() {
            ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");

            ArgumentCaptor<RealtimeEvents.VoteUpdateEvent> event =
                    ArgumentCaptor.forClass(RealtimeEvents.VoteUpdateEvent.class);
            verify(broadcastRegistry).broadcastVote(eq(COMPLAINT_ID), event.capture());
            assertThat(event.getValue().getAction()).isEqualTo("created");
            assertThat(event.getValue().getVoteType()).isEqualTo("upvote");
            assertThat(event.getValue().getTotalVotes()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Priority recomputation")
    class PriorityTests {

        @Test
        @DisplayName("label flips to high once upvotes push the score to 700")
        void priorityFlipsToHigh() {
            VoteLedger ledger = ledger(new InMemoryVoteRepository());
            List<VoteOutcome> flips = new ArrayList<>();

            for (int i = 1; i <= 81; i++) {
                VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "voter-" + i, "upvote");
                if (outcome.isPriorityUpdated()) {
                    flips.add(outcome);
                }
                if (i < 60) {
                    assertThat(outcome.isPriorityUpdated()).isFalse();
                }
            }

            assertThat(flips).hasSize(1);
            VoteOutcome flip = flips.get(0);
            assertThat(flip.getUpvotes()).isEqualTo(60);
            assertThat(flip.getOldPriority()).isEqualTo(Priority.MEDIUM);
            assertThat(flip.getNewPriority()).isEqualTo(Priority.HIGH);
            assertThat(flip.getPriorityScore()).isEqualTo(700);
            assertThat(stored().getPriority()).isEqualTo(Priority.HIGH);
            assertThat(counter("voice.votes.priority_flips")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("removing votes can bring the label back down")
        void priorityFlipsBack() {
            VoteLedger ledger = ledger(new InMemoryVoteRepository());
            for (int i = 1; i <= 60; i++) {
                ledger.vote(COMPLAINT_ID, "voter-" + i, "upvote");
            }

            VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "voter-60", "upvote");

            assertThat(outcome.isPriorityUpdated()).isTrue();
            assertThat(outcome.getOldPriority()).isEqualTo(Priority.HIGH);
            assertThat(outcome.getNewPriority()).isEqualTo(Priority.MEDIUM);
        }
    }

    @Nested
    @DisplayName("Rejected votes")
    class RejectionTests {

        @Test
        @DisplayName("unknown complaint fails with not found")
        void unknownComplaint() {
            VoteLedger ledger = ledger(new InMemoryVoteRepository());

            assertThatThrownBy(() -> ledger.vote("missing", "21CS0002", "upvote"))
                    .isInstanceOf(ComplaintNotFoundException.class);
            verify(broadcastRegistry, never()).broadcastVote(anyString(), any());
        }

        @Test
        @DisplayName("unknown vote type fails as invalid input")
        void invalidVoteType() {
            VoteLedger ledger = ledger(new InMemoryVoteRepository());

            assertThatThrownBy(() -> ledger.vote(COMPLAINT_ID, "21CS0002", "sideways"))
                    .isInstanceOf(InvalidVoteTypeException.class)
                    .isInstanceOf(InvalidInputException.class);
            assertThat(stored().getUpvotes()).isZero();
        }

        @ParameterizedTest
        @ValueSource(strings = {" upvote ", "UPVOTE", "Downvote"})
        @DisplayName("vote type must match a label exactly")
        void voteTypeIsExact(String voteType) {
            VoteLedger ledger = ledger(new InMemoryVoteRepository());

            assertThatThrownBy(() -> ledger.vote(COMPLAINT_ID, "21CS0002", voteType))
                    .isInstanceOf(InvalidVoteTypeException.class);
            assertThat(stored().getUpvotes()).isZero();
            assertThat(stored().getDownvotes()).isZero();
        }

        @Test
        @DisplayName("blank voter id fails as invalid input")
        void blankVoter() {
            VoteLedger ledger = ledger(new InMemoryVoteRepository());

            assertThatThrownBy(() -> ledger.vote(COMPLAINT_ID, " ", "upvote"))
                    .isInstanceOf(InvalidInputException.class);
        }
    }

    @Nested
    @DisplayName("Concurrent insert conflicts")
    class ConflictTests {

        @Test
        @DisplayName("a single collision is retried and succeeds")
        void collisionRetriedOnce() {
            CollidingVoteRepository votes = new CollidingVoteRepository(1);
            VoteLedger ledger = ledger(votes);

            VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");

            assertThat(outcome.getAction()).isEqualTo(VoteAction.CREATED);
            assertThat(votes.attempts.get()).isEqualTo(2);
            assertThat(stored().getUpvotes()).isEqualTo(1);
            assertThat(counter("voice.votes.conflicts")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a repeated collision surfaces as a conflict")
        void repeatedCollisionSurfaces() {
            CollidingVoteRepository votes = new CollidingVoteRepository(Integer.MAX_VALUE);
            VoteLedger ledger = ledger(votes);

            assertThatThrownBy(() -> ledger.vote(COMPLAINT_ID, "21CS0002", "upvote"))
                    .isInstanceOf(VoteConflictException.class)
                    .hasCauseInstanceOf(DuplicateVoteException.class);
            assertThat(votes.attempts.get()).isEqualTo(2);
            assertThat(stored().getUpvotes()).isZero();
            assertThat(voterRepository.findById("21CS0002")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Storage failures")
    class StorageFailureTests {

        @Test
        @DisplayName("transient failures are retried until the vote lands")
        void transientFailureRetried() {
            InMemoryVoteRepository votes = new InMemoryVoteRepository();
            VoteLedger ledger = ledger(votes);
            complaintRepository.failNextSaves(2);

            VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");

            assertThat(outcome.getUpvotes()).isEqualTo(1);
            assertThat(votes.count()).isEqualTo(1);
            assertThat(counter("voice.persistence.retries")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("exhausted retries leave no partial state")
        void exhaustedRetriesLeaveNoTrace() {
            InMemoryVoteRepository votes = new InMemoryVoteRepository();
            VoteLedger ledger = ledger(votes);
            complaintRepository.failNextSaves(10);

            assertThatThrownBy(() -> ledger.vote(COMPLAINT_ID, "21CS0002", "upvote"))
                    .isInstanceOf(PersistenceUnavailableException.class);

            complaintRepository.failNextSaves(0);
            assertThat(complaintRepository.getFailedSaves()).isEqualTo(3);
            assertThat(votes.count()).isZero();
            assertThat(stored().getUpvotes()).isZero();
            assertThat(voterRepository.findById("21CS0002")).isEmpty();
            assertThat(counter("voice.persistence.failures")).isEqualTo(1.0);
            verify(broadcastRegistry, never()).broadcastVote(anyString(), any());
        }

        @Test
        @DisplayName("a failed voter registration undoes the vote and counters")
        void voterRegistrationFailureUndoesVote() {
            voterRepository = new InMemoryVoterRepository() {
                @Override
                public Voter registerIfAbsent(String voterId) {
                    throw new TransientPersistenceException("voter table unavailable");
                }
            };
            InMemoryVoteRepository votes = new InMemoryVoteRepository();
            VoteLedger ledger = ledger(votes);

            assertThatThrownBy(() -> ledger.vote(COMPLAINT_ID, "21CS0002", "upvote"))
                    .isInstanceOf(PersistenceUnavailableException.class);

            assertThat(votes.count()).isZero();
            assertThat(stored().getUpvotes()).isZero();
            assertThat(stored().getPriorityScore()).isEqualTo(400);
            verify(broadcastRegistry, never()).broadcastVote(anyString(), any());
        }

        @Test
        @DisplayName("a voter is registered once the vote is stored")
        void voterRegisteredOnSuccess() {
            ledger(new InMemoryVoteRepository()).vote(COMPLAINT_ID, "21CS0002", "upvote");

            assertThat(voterRepository.findById("21CS0002"))
                    .hasValueSatisfying(voter -> assertThat(voter.getName()).isNull());
        }

        @Test
        @DisplayName("a failed broadcast does not fail the vote")
        void broadcastFailureIsIsolated() {
            when(broadcastRegistry.broadcastVote(anyString(), any()))
                    .thenThrow(new IllegalStateException("registry unavailable"));
            VoteLedger ledger = ledger(new InMemoryVoteRepository());

            VoteOutcome outcome = ledger.vote(COMPLAINT_ID, "21CS0002", "upvote");

            assertThat(outcome.getUpvotes()).isEqualTo(1);
            assertThat(stored().getUpvotes()).isEqualTo(1);
            assertThat(counter("voice.realtime.broadcast_failures")).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("concurrent voters are all counted")
    void concurrentVotersAllCounted() throws Exception {
        InMemoryVoteRepository votes = new InMemoryVoteRepository();
        VoteLedger ledger = ledger(votes);
        int voters = 64;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<VoteOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < voters; i++) {
                String voterId = "voter-" + i;
                String type = i % 4 == 0 ? "downvote" : "upvote";
                tasks.add(() -> ledger.vote(COMPLAINT_ID, voterId, type));
            }
            for (Future<VoteOutcome> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        Complaint complaint = stored();
        assertThat(votes.count()).isEqualTo(voters);
        assertThat(complaint.getUpvotes()).isEqualTo(48);
        assertThat(complaint.getDownvotes()).isEqualTo(16);
    }

    /**
     * Vote store that behaves as if another request inserted the same vote
     * first, for the given number of inserts.
     */
    private static class CollidingVoteRepository extends InMemoryVoteRepository {

        private final AtomicInteger collisionsLeft;
        private final AtomicInteger attempts = new AtomicInteger();

        CollidingVoteRepository(int collisions) {
            this.collisionsLeft = new AtomicInteger(collisions);
        }

        @Override
        public Vote insert(Vote vote) {
            attempts.incrementAndGet();
            if (collisionsLeft.getAndDecrement() > 0) {
                throw new DuplicateVoteException(vote.getComplaintId(), vote.getVoterId());
            }
            return super.insert(vote);
        }
    }
}

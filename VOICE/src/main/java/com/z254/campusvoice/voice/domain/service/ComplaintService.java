package com.z254.campusvoice.voice.domain.service;

import com.z254.campusvoice.voice.classification.AuthorityDirectory;
import com.z254.campusvoice.voice.classification.AuthorityRoute;
import com.z254.campusvoice.voice.classification.ClassificationGateway;
import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.exception.ComplaintNotFoundException;
import com.z254.campusvoice.voice.domain.exception.InvalidInputException;
import com.z254.campusvoice.voice.domain.model.Category;
import com.z254.campusvoice.voice.domain.model.Classification;
import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.ComplaintStatus;
import com.z254.campusvoice.voice.domain.model.Priority;
import com.z254.campusvoice.voice.domain.model.Voter;
import com.z254.campusvoice.voice.domain.repository.ComplaintRepository;
import com.z254.campusvoice.voice.domain.repository.StatusChangeRepository;
import com.z254.campusvoice.voice.domain.repository.VoteRepository;
import com.z254.campusvoice.voice.domain.repository.VoterRepository;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger.ComplaintEventType;
import com.z254.campusvoice.voice.persistence.ComplaintLockManager;
import com.z254.campusvoice.voice.persistence.StorageAccess;
import com.z254.campusvoice.voice.scoring.PriorityScore;
import com.z254.campusvoice.voice.scoring.PriorityScorer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Complaint intake, queries and priority recalculation.
 */
@Service
public class ComplaintService {

    private final ComplaintRepository complaintRepository;
    private final VoteRepository voteRepository;
    private final VoterRepository voterRepository;
    private final StatusChangeRepository statusChangeRepository;
    private final ClassificationGateway classificationGateway;
    private final AuthorityDirectory authorityDirectory;
    private final PriorityScorer priorityScorer;
    private final ComplaintLockManager lockManager;
    private final StorageAccess storageAccess;
    private final VoiceProperties.Feed feedConfig;
    private final VoiceMetrics metrics;
    private final VoiceStructuredLogger structuredLogger;

    public ComplaintService(ComplaintRepository complaintRepository,
                            VoteRepository voteRepository,
                            VoterRepository voterRepository,
                            StatusChangeRepository statusChangeRepository,
                            ClassificationGateway classificationGateway,
                            AuthorityDirectory authorityDirectory,
                            PriorityScorer priorityScorer,
                            ComplaintLockManager lockManager,
                            StorageAccess storageAccess,
                            VoiceProperties properties,
                            VoiceMetrics metrics,
                            VoiceStructuredLogger structuredLogger) {
        this.complaintRepository = complaintRepository;
        this.voteRepository = voteRepository;
        this.voterRepository = voterRepository;
        this.statusChangeRepository = statusChangeRepository;
        this.classificationGateway = classificationGateway;
        this.authorityDirectory = authorityDirectory;
        this.priorityScorer = priorityScorer;
        this.lockManager = lockManager;
        this.storageAccess = storageAccess;
        this.feedConfig = properties.getFeed();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Classify, route and store a new complaint. Classification happens before
     * anything is locked and always yields a result.
     */
    public Mono<Complaint> submit(NewComplaint request) {
        requireText(request.getSubmitterId(), "submitter_id");
        requireText(request.getTitle(), "title");
        requireText(request.getDescription(), "description");

        return classificationGateway.classify(request.getTitle(), request.getDescription())
                .flatMap(classification -> Mono.fromCallable(() -> create(request, classification))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    public Optional<Complaint> getComplaint(String complaintId) {
        return complaintRepository.findById(complaintId);
    }

    public Complaint requireComplaint(String complaintId) {
        return complaintRepository.findById(complaintId)
                .orElseThrow(() -> new ComplaintNotFoundException(complaintId));
    }

    /**
     * Public complaints, newest first.
     */
    public ComplaintPage listPublic(ComplaintStatus status, Priority priority, Integer limit, Integer offset) {
        return page(c -> c.isPublic()
                        && (status == null || c.getStatus() == status)
                        && (priority == null || c.getPriority() == priority),
                limit, offset);
    }

    /**
     * Complaints raised by one student, newest first, regardless of visibility.
     */
    public ComplaintPage listBySubmitter(String submitterId, Integer limit, Integer offset) {
        requireText(submitterId, "submitterId");
        return page(c -> submitterId.equals(c.getSubmitterId()), limit, offset);
    }

    /**
     * Complaints routed to the authority responsible for a category key.
     *
     * @throws InvalidInputException if the key is not a known category
     */
    public ComplaintPage listForAuthority(String authorityType, ComplaintStatus status, Integer limit, Integer offset) {
        Category category = Category.fromLabel(authorityType)
                .orElseThrow(() -> new InvalidInputException("Invalid authority type '" + authorityType
                        + "'. Must be one of: " + Arrays.stream(Category.values())
                        .map(Category::getLabel).collect(Collectors.joining(", "))));
        String authority = authorityDirectory.routeFor(category).authority();
        return page(c -> authority.equals(c.getAssignedAuthority())
                        && (status == null || c.getStatus() == status),
                limit, offset);
    }

    /**
     * Recompute the score from the stored classification and current counts
     * and store both score and label. No re-classification takes place.
     */
    public PriorityRecalculation recalculatePriority(String complaintId) {
        PriorityRecalculation result = storageAccess.execute("priority-recalculation",
                () -> lockManager.withLock(complaintId, () -> {
                    Complaint current = requireComplaint(complaintId);
                    PriorityScore score = priorityScorer.score(
                            current.getClassification(), current.getUpvotes(), current.getDownvotes());

                    Complaint updated = current.copy();
                    updated.setPriority(score.label());
                    updated.setPriorityScore(score.score());
                    updated.setUpdatedAt(Instant.now());
                    complaintRepository.save(updated);
                    return new PriorityRecalculation(updated, current.getPriority(), score.label(), score.score());
                }));

        Map<String, Object> details = new HashMap<>();
        details.put("oldPriority", result.oldPriority().getLabel());
        details.put("newPriority", result.newPriority().getLabel());
        details.put("score", result.score());
        structuredLogger.logComplaintEvent(complaintId, ComplaintEventType.PRIORITY_RECALCULATED,
                "Priority recalculated", details);
        return result;
    }

    public OverallStats overallStats() {
        List<Complaint> complaints = complaintRepository.findAll();
        return new OverallStats(
                complaints.size(),
                voteRepository.count(),
                voterRepository.count(),
                statusChangeRepository.count(),
                countBy(complaints, c -> c.getStatus().getLabel(),
                        Arrays.stream(ComplaintStatus.values()).map(ComplaintStatus::getLabel).toList()),
                countBy(complaints, c -> c.getPriority().getLabel(),
                        Arrays.stream(Priority.values()).map(Priority::getLabel).toList()));
    }

    public Optional<Voter> findVoter(String voterId) {
        return voterRepository.findById(voterId);
    }

    private Complaint create(NewComplaint request, Classification classification) {
        voterRepository.upsert(Voter.builder()
                .id(request.getSubmitterId())
                .name(request.getSubmitterName())
                .email(request.getSubmitterEmail())
                .department(request.getDepartment())
                .stayType(request.getStayType())
                .build());

        Category category = Category.from(classification.getCategory());
        AuthorityRoute route = authorityDirectory.routeFor(category);
        PriorityScore initialScore = priorityScorer.score(classification, 0, 0);
        Instant now = Instant.now();

        Complaint complaint = Complaint.builder()
                .id(UUID.randomUUID().toString())
                .title(request.getTitle().trim())
                .description(request.getDescription().trim())
                .visibility(request.getVisibility())
                .status(ComplaintStatus.RAISED)
                .priority(Priority.fromReportedLabel(classification.getPriority()).orElse(Priority.MEDIUM))
                .priorityScore(initialScore.score())
                .category(category)
                .assignedAuthority(route.authority())
                .authorityEmail(route.email())
                .authorityDepartment(route.department())
                .classification(classification)
                .submitterId(request.getSubmitterId())
                .imageUrl(request.getImageUrl())
                .submittedAt(now)
                .updatedAt(now)
                .build();

        storageAccess.execute("complaint-create", () -> complaintRepository.save(complaint));
        metrics.recordComplaintSubmitted();

        Map<String, Object> details = new HashMap<>();
        details.put("category", category.getLabel());
        details.put("priority", complaint.getPriority().getLabel());
        details.put("score", complaint.getPriorityScore());
        details.put("authority", route.authority());
        structuredLogger.logComplaintEvent(complaint.getId(),
                classification.isFallback() ? ComplaintEventType.CLASSIFICATION_FALLBACK : ComplaintEventType.CLASSIFIED,
                classification.isFallback() ? "Complaint routed with fallback classification" : "Complaint classified",
                details);
        structuredLogger.logComplaintEvent(complaint.getId(), ComplaintEventType.SUBMITTED,
                "Complaint submitted", Map.of("submitterId", complaint.getSubmitterId()));
        return complaint;
    }

    private ComplaintPage page(Predicate<Complaint> filter, Integer limit, Integer offset) {
        int size = limit == null ? feedConfig.getDefaultPageSize()
                : Math.max(1, Math.min(feedConfig.getMaxPageSize(), limit));
        int skip = offset == null ? 0 : Math.max(0, offset);

        List<Complaint> matching = complaintRepository.findAll().stream()
                .filter(filter)
                .sorted(Comparator.comparing(Complaint::getSubmittedAt).reversed()
                        .thenComparing(Complaint::getId))
                .toList();

        List<Complaint> pageItems = matching.stream()
                .skip(skip)
                .limit(size)
                .toList();
        return new ComplaintPage(pageItems, matching.size(), size, skip);
    }

    private static Map<String, Long> countBy(List<Complaint> complaints,
                                             Function<Complaint, String> key,
                                             List<String> allKeys) {
        Map<String, Long> counts = new LinkedHashMap<>();
        allKeys.forEach(k -> counts.put(k, 0L));
        complaints.forEach(c -> counts.merge(key.apply(c), 1L, Long::sum));
        return counts;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
    }
}

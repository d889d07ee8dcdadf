package com.z254.campusvoice.voice.api.v1;

import com.z254.campusvoice.voice.api.dto.OverallStatsDto;
import com.z254.campusvoice.voice.domain.service.ComplaintService;
import com.z254.campusvoice.voice.domain.service.OverallStats;
import com.z254.campusvoice.voice.realtime.BroadcastRegistry;
import com.z254.campusvoice.voice.realtime.RegistryStats;
import com.z254.campusvoice.voice.realtime.WatcherInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Platform and live feed statistics.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Stats", description = "Platform statistics")
public class StatsController {

    private final ComplaintService complaintService;
    private final BroadcastRegistry broadcastRegistry;

    public StatsController(ComplaintService complaintService, BroadcastRegistry broadcastRegistry) {
        this.complaintService = complaintService;
        this.broadcastRegistry = broadcastRegistry;
    }

    @GetMapping("/stats")
    @Operation(summary = "Overall stats", description = "Complaint, vote and voter totals")
    public Mono<ResponseEntity<OverallStatsDto>> getStats() {
        return Mono.fromCallable(() -> {
                    OverallStats stats = complaintService.overallStats();
                    return OverallStatsDto.builder()
                            .totalComplaints(stats.totalComplaints())
                            .totalVotes(stats.totalVotes())
                            .totalVoters(stats.totalVoters())
                            .totalStatusChanges(stats.totalStatusChanges())
                            .byStatus(stats.byStatus())
                            .byPriority(stats.byPriority())
                            .activeRealtimeConnections(broadcastRegistry.getStats().getTotalActiveConnections())
                            .build();
                })
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/ws/stats")
    @Operation(summary = "Live feed stats", description = "Connection counts of the vote feed", tags = "Realtime")
    public Mono<ResponseEntity<RegistryStats>> getRealtimeStats() {
        return Mono.fromCallable(broadcastRegistry::getStats)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/ws/watchers/{complaintId}")
    @Operation(summary = "Watchers", description = "Open feed connections for one complaint", tags = "Realtime")
    public Mono<ResponseEntity<List<WatcherInfo>>> getWatchers(
            @Parameter(description = "Complaint ID") @PathVariable String complaintId) {
        return Mono.fromCallable(() -> broadcastRegistry.getWatchers(complaintId))
                .map(ResponseEntity::ok);
    }
}

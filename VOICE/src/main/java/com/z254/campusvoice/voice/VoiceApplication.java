package com.z254.campusvoice.voice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * VOICE - Complaint service for the CampusVoice platform.
 *
 * <p>VOICE provides:
 * <ul>
 *   <li>Complaint intake - AI classification with a deterministic fallback and authority routing</li>
 *   <li>Vote ledger - One vote per student per complaint with toggle and switch semantics</li>
 *   <li>Priority scoring - Vote-driven recalculation of the priority label</li>
 *   <li>Status workflow - Authority status updates with an append-only audit trail</li>
 *   <li>Live feed - Per-complaint WebSocket fan-out of vote and status changes</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class VoiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceApplication.class, args);
    }
}

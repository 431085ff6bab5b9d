package com.phillippitts.voiceanalysis.presentation.controller;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.presentation.dto.SaveRecordingRequest;
import com.phillippitts.voiceanalysis.service.recording.RecordingSession;
import com.phillippitts.voiceanalysis.service.recording.RecordingSessionRegistry;
import com.phillippitts.voiceanalysis.service.recording.RecordingSnapshot;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Drives recording sessions. Every transition answers with the session snapshot;
 * a failed device call shows up in {@code lastError} with the state unchanged.
 */
@RestController
@RequestMapping("/api/recordings")
class RecordingController {

    private final RecordingSessionRegistry registry;

    RecordingController(RecordingSessionRegistry registry) {
        this.registry = registry;
    }

    @PostMapping
    ResponseEntity<RecordingSnapshot> start() {
        RecordingSession session = registry.createAndStart();
        return ResponseEntity.status(HttpStatus.CREATED).body(session.snapshot());
    }

    @GetMapping
    List<RecordingSnapshot> list() {
        return registry.all().stream().map(RecordingSession::snapshot).toList();
    }

    @GetMapping("/{sessionId}")
    RecordingSnapshot get(@PathVariable UUID sessionId) {
        return registry.require(sessionId).snapshot();
    }

    @PostMapping("/{sessionId}/pause")
    RecordingSnapshot pause(@PathVariable UUID sessionId) {
        RecordingSession session = registry.require(sessionId);
        session.pause();
        return session.snapshot();
    }

    @PostMapping("/{sessionId}/resume")
    RecordingSnapshot resume(@PathVariable UUID sessionId) {
        RecordingSession session = registry.require(sessionId);
        session.resume();
        return session.snapshot();
    }

    @PostMapping("/{sessionId}/stop")
    RecordingSnapshot stop(@PathVariable UUID sessionId) {
        RecordingSession session = registry.require(sessionId);
        session.stop();
        return session.snapshot();
    }

    @PostMapping("/{sessionId}/restart")
    RecordingSnapshot restart(@PathVariable UUID sessionId) {
        RecordingSession session = registry.require(sessionId);
        session.restart();
        return session.snapshot();
    }

    @PostMapping("/{sessionId}/cancel")
    RecordingSnapshot cancel(@PathVariable UUID sessionId) {
        RecordingSession session = registry.require(sessionId);
        session.cancel();
        return session.snapshot();
    }

    @PostMapping("/{sessionId}/save")
    ResponseEntity<AnalysisRecord> save(@PathVariable UUID sessionId,
                                        @Valid @RequestBody SaveRecordingRequest request) {
        AnalysisRecord record = registry.require(sessionId).save(request.title(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }
}

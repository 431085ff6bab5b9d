package com.phillippitts.voiceanalysis.presentation.controller;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.AnalysisSummary;
import com.phillippitts.voiceanalysis.domain.PredictionChannel;
import com.phillippitts.voiceanalysis.domain.SendStatus;
import com.phillippitts.voiceanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.voiceanalysis.exception.FileStorageExceptionBuilder;
import com.phillippitts.voiceanalysis.presentation.dto.FeedbackRequest;
import com.phillippitts.voiceanalysis.presentation.dto.TagsRequest;
import com.phillippitts.voiceanalysis.service.persistence.PersistenceCoordinator;
import com.phillippitts.voiceanalysis.service.store.AnalysisOrder;
import com.phillippitts.voiceanalysis.service.upload.UploadService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Read and write operations on stored analyses.
 */
@RestController
@RequestMapping("/api/analyses")
class AnalysisController {

    private final PersistenceCoordinator coordinator;
    private final UploadService uploadService;

    AnalysisController(PersistenceCoordinator coordinator, UploadService uploadService) {
        this.coordinator = coordinator;
        this.uploadService = uploadService;
    }

    @GetMapping
    List<AnalysisRecord> list(@RequestParam(required = false) String order,
                              @RequestParam(required = false) Integer limit) {
        return coordinator.queryAll(AnalysisOrder.parse(order), limit);
    }

    @GetMapping("/recent")
    List<AnalysisSummary> recent(@RequestParam(defaultValue = "5") int limit) {
        return coordinator.getRecentAnalyses(limit);
    }

    @GetMapping("/tags")
    List<String> allTags() {
        return coordinator.getAllTags();
    }

    @GetMapping("/status/{status}")
    List<AnalysisRecord> byStatus(@PathVariable String status) {
        return coordinator.getAnalysesByStatus(parseStatus(status));
    }

    @GetMapping("/{id}")
    AnalysisRecord get(@PathVariable long id) {
        return coordinator.getAnalysisById(id).orElseThrow(() -> new AnalysisNotFoundException(id));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<AnalysisRecord> upload(@RequestParam("file") MultipartFile file,
                                          @RequestParam("title") String title,
                                          @RequestParam(value = "description", required = false) String description) {
        try (InputStream content = file.getInputStream()) {
            AnalysisRecord record = uploadService.upload(content, file.getOriginalFilename(), title, description);
            return ResponseEntity.status(HttpStatus.CREATED).body(record);
        } catch (IOException e) {
            throw FileStorageExceptionBuilder.create("Failed to read uploaded file")
                    .operation("upload")
                    .cause(e)
                    .build();
        }
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable long id) {
        coordinator.deleteAnalysis(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/feedback/{channel}")
    AnalysisRecord feedback(@PathVariable long id, @PathVariable String channel,
                            @RequestBody FeedbackRequest request) {
        return coordinator.setFeedback(id, PredictionChannel.parse(channel), request.feedback());
    }

    @PutMapping("/{id}/tags")
    AnalysisRecord tags(@PathVariable long id, @Valid @RequestBody TagsRequest request) {
        return coordinator.updateTags(id, request.tags());
    }

    @PostMapping("/{id}/retry")
    AnalysisRecord retry(@PathVariable long id) {
        return coordinator.retryAnalysis(id);
    }

    /** Accepts a status name (any case) or its numeric code. */
    static SendStatus parseStatus(String status) {
        String value = status.trim();
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return SendStatus.fromCode(Integer.parseInt(value));
        }
        return SendStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}

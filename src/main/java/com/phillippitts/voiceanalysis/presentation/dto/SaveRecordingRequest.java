package com.phillippitts.voiceanalysis.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/recordings/{sessionId}/save}.
 */
public record SaveRecordingRequest(
        @NotBlank @Size(max = 255) String title,
        @Size(max = 2000) String description
) { }

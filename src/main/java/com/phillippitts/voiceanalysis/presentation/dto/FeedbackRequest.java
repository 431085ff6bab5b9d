package com.phillippitts.voiceanalysis.presentation.dto;

/**
 * Body of {@code PUT /api/analyses/{id}/feedback/{channel}}.
 *
 * @param feedback {@code true}/{@code false}, or {@code null} to clear
 */
public record FeedbackRequest(Boolean feedback) { }

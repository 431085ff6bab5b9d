package com.phillippitts.voiceanalysis.presentation.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of {@code PUT /api/analyses/{id}/tags}. Replaces the whole tag set.
 */
public record TagsRequest(@NotNull List<String> tags) { }

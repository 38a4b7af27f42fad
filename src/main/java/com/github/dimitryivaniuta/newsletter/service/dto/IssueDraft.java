package com.github.dimitryivaniuta.newsletter.service.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Issue handed over by the authoring flow for publication.
 */
public record IssueDraft(
        @NotNull UUID id,
        @NotBlank String title,
        @NotBlank String textContent,
        @NotBlank String htmlContent,
        @NotNull Instant publishedAt
) {}

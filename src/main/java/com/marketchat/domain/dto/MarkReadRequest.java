package com.marketchat.domain.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record MarkReadRequest(@NotNull(message = "userId is required") @Positive Long userId) {
}

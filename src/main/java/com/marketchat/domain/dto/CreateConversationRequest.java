package com.marketchat.domain.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreateConversationRequest(
        @NotNull(message = "buyerId is required") @Positive Long buyerId,
        @NotNull(message = "sellerId is required") @Positive Long sellerId,
        @Positive Long productId
) {
}

package com.marketchat.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * @param socketId 上线时记录的连接标识，可选
 */
public record UpdateStatusRequest(
        @NotNull(message = "isOnline is required") @JsonProperty("isOnline") Boolean online,
        String socketId
) {
}

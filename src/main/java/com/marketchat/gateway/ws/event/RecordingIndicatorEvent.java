package com.marketchat.gateway.ws.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RecordingIndicatorEvent(Long conversationId, @JsonProperty("isRecording") Boolean isRecording) implements WsInboundEvent {

    @Override
    public void validate() {
        WsInboundEvent.requirePositive(conversationId, "missing_conversation_id");
    }

    public boolean recording() {
        return Boolean.TRUE.equals(isRecording);
    }
}

package com.marketchat.domain.controller;

import com.marketchat.common.api.Result;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.MessageDto;
import com.marketchat.domain.dto.SendMessageRequest;
import com.marketchat.domain.dto.SubmitResult;
import com.marketchat.domain.enums.MessageType;
import com.marketchat.gateway.ws.WsSendMessageHandler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletionException;

@RequiredArgsConstructor
@RestController
public class MessageController {

    private final WsSendMessageHandler sendMessageHandler;

    /**
     * 与 WS send_message 同一条链路：会话串行落库，扇出 new_message，发送方的回执推给他的在线连接。
     */
    @PostMapping("/messages")
    public Result<MessageDto> send(@Valid @RequestBody SendMessageRequest req) {
        MessageType type = req.type();
        if (type == null) {
            throw ChatException.invalidPayload("invalid_message_type");
        }
        SubmitResult result;
        try {
            result = sendMessageHandler.send(req.conversationId(), req.senderId(), type, req.content(),
                    req.clientMsgId(), null).join();
        } catch (CompletionException e) {
            throw ChatException.unwrap(e);
        }
        return Result.ok(MessageDto.from(result.message()));
    }
}

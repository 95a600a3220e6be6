package com.marketchat.domain.controller;

import com.marketchat.common.api.Result;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.UpdateStatusRequest;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.service.PresenceService;
import com.marketchat.gateway.ws.WsPresenceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletionException;

@RequiredArgsConstructor
@RestController
public class PresenceController {

    private final PresenceService presenceService;
    private final WsPresenceService wsPresenceService;

    /**
     * 没有在线记录的用户按离线返回。
     */
    @GetMapping("/users/{userId}/status")
    public Result<UserPresenceDto> status(@PathVariable("userId") Long userId) {
        return Result.ok(presenceService.get(userId));
    }

    /**
     * 手动改在线状态，对端收到 user_status；上线时顺带补送达。
     */
    @PutMapping("/users/{userId}/status")
    public Result<UserPresenceDto> update(@PathVariable("userId") Long userId,
                                          @Valid @RequestBody UpdateStatusRequest req) {
        if (userId == null || userId <= 0) {
            throw ChatException.invalidPayload("missing_user_id");
        }
        try {
            return Result.ok(wsPresenceService.updateStatus(userId, req.online(), req.socketId()).join());
        } catch (CompletionException e) {
            throw ChatException.unwrap(e);
        }
    }
}

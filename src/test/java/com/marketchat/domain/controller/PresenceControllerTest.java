package com.marketchat.domain.controller;

import com.marketchat.common.error.ChatException;
import com.marketchat.common.web.GlobalExceptionHandler;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.service.PresenceService;
import com.marketchat.gateway.ws.WsPresenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PresenceControllerTest {

    private PresenceService presenceService;
    private WsPresenceService wsPresenceService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        presenceService = mock(PresenceService.class);
        wsPresenceService = mock(WsPresenceService.class);
        mvc = MockMvcBuilders.standaloneSetup(new PresenceController(presenceService, wsPresenceService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void status_ShouldReturnOfflineDefault_WhenUserNeverConnected() throws Exception {
        when(presenceService.get(42L)).thenReturn(UserPresenceDto.offline(42L));

        mvc.perform(get("/users/42/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.userId").value(42))
                .andExpect(jsonPath("$.data.isOnline").value(false));
    }

    @Test
    void status_ShouldReturnOnlineUser() throws Exception {
        when(presenceService.get(2L)).thenReturn(new UserPresenceDto(2L, true, LocalDateTime.now(), "conn-1"));

        mvc.perform(get("/users/2/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isOnline").value(true));
    }

    @Test
    void update_ShouldSetOnlineThroughPresenceQueue() throws Exception {
        when(wsPresenceService.updateStatus(2L, true, "sock-1")).thenReturn(
                CompletableFuture.completedFuture(new UserPresenceDto(2L, true, LocalDateTime.now(), "sock-1")));

        mvc.perform(put("/users/2/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isOnline\":true,\"socketId\":\"sock-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isOnline").value(true));
        verify(wsPresenceService).updateStatus(2L, true, "sock-1");
    }

    @Test
    void update_ShouldRejectMissingFlag() throws Exception {
        mvc.perform(put("/users/2/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"socketId\":\"sock-1\"}"))
                .andExpect(status().isBadRequest());
        verify(wsPresenceService, never()).updateStatus(anyLong(), anyBoolean(), any());
    }

    @Test
    void update_ShouldMapUnknownUserToNotFound() throws Exception {
        when(wsPresenceService.updateStatus(99L, false, null))
                .thenReturn(CompletableFuture.failedFuture(ChatException.notFound("user_not_found")));

        mvc.perform(put("/users/99/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isOnline\":false}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("user_not_found"));
    }
}

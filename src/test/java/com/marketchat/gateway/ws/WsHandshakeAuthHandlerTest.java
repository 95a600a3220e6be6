package com.marketchat.gateway.ws;

import com.marketchat.gateway.session.SessionRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WsHandshakeAuthHandlerTest {

    private SessionRegistry sessionRegistry;
    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        sessionRegistry = mock(SessionRegistry.class);
        ch = new EmbeddedChannel(new WsHandshakeAuthHandler("/ws", sessionRegistry));
    }

    @Test
    void shouldBindUserIdFromQuery() {
        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?userId=5"));

        verify(sessionRegistry).bind(ch, 5L);
        FullHttpRequest passed = ch.readInbound();
        assertThat(passed).isNotNull();
        passed.release();
    }

    @Test
    void shouldPreferHeaderUserId() {
        DefaultFullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?userId=5");
        req.headers().set("userid", "7");

        ch.writeInbound(req);

        verify(sessionRegistry).bind(ch, 7L);
        FullHttpRequest passed = ch.readInbound();
        passed.release();
    }

    @Test
    void shouldRespond401_WhenUserIdMissing() {
        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws"));

        FullHttpResponse resp = ch.readOutbound();
        assertThat(resp.status()).isEqualTo(HttpResponseStatus.UNAUTHORIZED);
        assertThat(resp.content().toString(CharsetUtil.UTF_8)).isEqualTo("missing_user_id");
        resp.release();
        assertThat(ch.isOpen()).isFalse();
        verify(sessionRegistry, never()).bind(any(), anyLong());
    }

    @Test
    void shouldRespond401_WhenUserIdNotPositiveNumber() {
        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?userId=abc"));

        FullHttpResponse resp = ch.readOutbound();
        assertThat(resp.status()).isEqualTo(HttpResponseStatus.UNAUTHORIZED);
        assertThat(resp.content().toString(CharsetUtil.UTF_8)).isEqualTo("invalid_user_id");
        resp.release();
        verify(sessionRegistry, never()).bind(any(), anyLong());
    }

    @Test
    void shouldPassThroughOtherPaths() {
        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/health"));

        verify(sessionRegistry, never()).bind(any(), anyLong());
        FullHttpRequest passed = ch.readInbound();
        assertThat(passed.uri()).isEqualTo("/health");
        passed.release();
    }
}

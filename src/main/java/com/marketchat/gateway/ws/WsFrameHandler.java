package com.marketchat.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.marketchat.common.error.ChatException;
import com.marketchat.gateway.session.SessionRegistry;
import com.marketchat.gateway.ws.event.SendMessageEvent;
import com.marketchat.gateway.ws.event.WsInboundEvent;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * 每个连接一个实例：解析 JSON 文本帧 -> 校验 -> 交给 {@link WsEventDispatcher}；
 * 同时负责空闲检测与断线收尾。
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final WsEventDispatcher dispatcher;
    private final WsPresenceService presenceService;
    private final WsWriter wsWriter;

    public WsFrameHandler(ObjectMapper objectMapper,
                          SessionRegistry sessionRegistry,
                          WsEventDispatcher dispatcher,
                          WsPresenceService presenceService,
                          WsWriter wsWriter) {
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.dispatcher = dispatcher;
        this.presenceService = presenceService;
        this.wsWriter = wsWriter;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        Channel ch = ctx.channel();
        Long userId = sessionRegistry.userIdOf(ch);
        if (userId == null) {
            wsWriter.writeError(ch, ChatException.unauthorized("unauthorized"));
            ctx.close();
            return;
        }

        WsInboundEvent event;
        try {
            event = objectMapper.readValue(frame.text(), WsInboundEvent.class);
        } catch (InvalidTypeIdException e) {
            wsWriter.writeError(ch, ChatException.invalidPayload("unknown_event"));
            return;
        } catch (JsonProcessingException e) {
            wsWriter.writeError(ch, ChatException.invalidPayload("bad_json"));
            return;
        }
        if (event == null) {
            wsWriter.writeError(ch, ChatException.invalidPayload("bad_json"));
            return;
        }

        try {
            event.validate();
        } catch (ChatException e) {
            if (event instanceof SendMessageEvent s) {
                wsWriter.writeError(ch, WsEvents.MESSAGE_ERROR, e, null, s.clientMsgId());
            } else {
                wsWriter.writeError(ch, e);
            }
            return;
        }

        dispatcher.dispatch(ch, userId, event);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.READER_IDLE) {
            // 读空闲：客户端断网/异常退出/没按约定发心跳，关连接后由 channelInactive 收尾
            log.debug("reader idle, closing: {}", ctx.channel());
            ctx.close();
            return;
        }
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.WRITER_IDLE) {
            // 服务端心跳：刷新路由 TTL + 协议层 ping
            if (sessionRegistry.isAuthed(ctx.channel())) {
                sessionRegistry.touch(ctx.channel());
            }
            ctx.writeAndFlush(new PingWebSocketFrame());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Channel ch = ctx.channel();
        Long userId = sessionRegistry.userIdOf(ch);
        String connId = sessionRegistry.connIdOf(ch);
        long remaining = sessionRegistry.unbind(ch);
        if (userId != null && remaining >= 0) {
            String closeReason = ch.attr(SessionRegistry.ATTR_CLOSE_REASON).get();
            presenceService.onDisconnect(userId, connId, remaining, closeReason);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("ws channel error, closing: {}, err={}", ctx.channel(), cause.toString());
        ctx.close();
    }
}

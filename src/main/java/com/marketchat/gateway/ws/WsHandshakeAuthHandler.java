package com.marketchat.gateway.ws;

import cn.hutool.core.util.StrUtil;
import com.marketchat.gateway.session.SessionRegistry;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;

import java.util.List;
import java.util.Map;

/**
 * WebSocket 握手阶段（HTTP Upgrade）确定连接身份：
 * <ul>
 *   <li>从请求头 userid 或 query 参数 userId 取用户 id</li>
 *   <li>缺失或不是正整数：401 并关闭</li>
 *   <li>否则把 userId 绑定到 channel（登记本机会话 + 集群路由）</li>
 * </ul>
 * 用户是否存在在 join 时校验。
 */
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    static final String HEADER_USER_ID = "userid";
    static final String QUERY_USER_ID = "userId";

    private final String wsPath;
    private final SessionRegistry sessionRegistry;

    public WsHandshakeAuthHandler(String wsPath, SessionRegistry sessionRegistry) {
        this.wsPath = wsPath;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        if (sessionRegistry.isAuthed(ctx.channel())) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String raw = extractUserId(req);
        if (StrUtil.isBlank(raw)) {
            writeUnauthorizedAndClose(ctx, "missing_user_id");
            return;
        }
        long userId;
        try {
            userId = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            writeUnauthorizedAndClose(ctx, "invalid_user_id");
            return;
        }
        if (userId <= 0) {
            writeUnauthorizedAndClose(ctx, "invalid_user_id");
            return;
        }

        sessionRegistry.bind(ctx.channel(), userId);
        ctx.fireChannelRead(req.retain());
    }

    private String extractUserId(FullHttpRequest req) {
        String header = req.headers().get(HEADER_USER_ID);
        if (StrUtil.isNotBlank(header)) {
            return header;
        }
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        Map<String, List<String>> params = decoder.parameters();
        List<String> list = params.get(QUERY_USER_ID);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    private void writeUnauthorizedAndClose(ChannelHandlerContext ctx, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.UNAUTHORIZED,
                Unpooled.wrappedBuffer(bytes)
        );
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp);
        ctx.close();
    }
}

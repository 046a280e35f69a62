package com.teamchat.gateway.ws;

import com.teamchat.auth.service.JwtService;
import com.teamchat.gateway.session.SessionRegistry;
import io.jsonwebtoken.Claims;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 握手阶段（HTTP Upgrade）校验 accessToken：
 * <ul>
 *   <li>Authorization: Bearer &lt;token&gt; 或 query 参数 token</li>
 *   <li>只校验令牌并把 subject 写到 channel 上；查用户目录要访问数据库，放到握手完成后的引导阶段</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;

    public WsHandshakeAuthHandler(String wsPath, JwtService jwtService, SessionRegistry sessionRegistry) {
        this.wsPath = wsPath;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath) || sessionRegistry.isAuthed(ctx.channel())) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            writeUnauthorizedAndClose(ctx, "missing_access_token");
            return;
        }
        try {
            Claims claims = jwtService.parseAccessToken(token).getPayload();
            String subject = jwtService.getSubject(claims);
            ctx.channel().attr(SessionRegistry.ATTR_SUBJECT).set(subject);
            ctx.channel().attr(SessionRegistry.ATTR_ACCESS_EXP_MS)
                    .set(claims.getExpiration() == null ? null : claims.getExpiration().getTime());
            ctx.fireChannelRead(req.retain());
        } catch (Exception e) {
            log.debug("ws handshake rejected: err={}", e.toString());
            writeUnauthorizedAndClose(ctx, "invalid_access_token");
        }
    }

    static String extractAccessToken(FullHttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring("Bearer ".length()).trim();
        }
        List<String> tokens = new QueryStringDecoder(req.uri()).parameters().get("token");
        if (tokens == null || tokens.isEmpty()) {
            return null;
        }
        return tokens.get(0);
    }

    private static void writeUnauthorizedAndClose(ChannelHandlerContext ctx, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, HttpResponseStatus.UNAUTHORIZED, Unpooled.wrappedBuffer(bytes));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp);
        ctx.close();
    }
}

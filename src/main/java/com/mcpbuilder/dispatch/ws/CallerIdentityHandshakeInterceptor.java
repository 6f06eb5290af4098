package com.mcpbuilder.dispatch.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Resolves the caller identity for a WebSocket handshake from the {@code X-User-Id} header,
 * falling back to the {@code userId} query parameter. Handshakes without one are refused with 401.
 */
public class CallerIdentityHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CallerIdentityHandshakeInterceptor.class);

    public static final String USER_ID_ATTRIBUTE = "mcpbuilder.userId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String userId = request.getHeaders().getFirst("X-User-Id");
        if (userId == null || userId.isBlank()) {
            userId = UriComponentsBuilder.fromUri(request.getURI()).build()
                    .getQueryParams().getFirst("userId");
        }
        if (userId == null || userId.isBlank()) {
            log.debug("Rejecting WebSocket handshake from {} without a user id", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(USER_ID_ATTRIBUTE, userId.trim());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }
}

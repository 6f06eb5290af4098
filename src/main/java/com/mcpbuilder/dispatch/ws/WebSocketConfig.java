package com.mcpbuilder.dispatch.ws;

import com.mcpbuilder.core.realtime.RealtimeProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the {@link ProgressWebSocketHandler} at {@code /ws/progress}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ProgressWebSocketHandler progressWebSocketHandler;
    private final RealtimeProperties properties;

    public WebSocketConfig(ProgressWebSocketHandler progressWebSocketHandler, RealtimeProperties properties) {
        this.progressWebSocketHandler = progressWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(progressWebSocketHandler, "/ws/progress")
                .addInterceptors(new CallerIdentityHandshakeInterceptor())
                .setAllowedOrigins(properties.getAllowedOrigins().toArray(String[]::new));
    }
}

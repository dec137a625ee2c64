package com.example.dispatch_service.config;

import com.example.dispatch_service.auth.TokenHandshakeInterceptor;
import com.example.dispatch_service.handler.DispatchWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final DispatchWebSocketHandler dispatchWebSocketHandler;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;
    private final DispatchProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(dispatchWebSocketHandler, properties.getEndpoints())
                .addInterceptors(tokenHandshakeInterceptor)
                .setAllowedOrigins(properties.getAllowedOrigins());
    }
}

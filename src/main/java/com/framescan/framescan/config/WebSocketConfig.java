package com.framescan.framescan.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.framescan.framescan.websocket.ScanWebSocketHandler;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ScanWebSocketHandler scanWebSocketHandler;
    private final ScanProperties properties;

    public WebSocketConfig(ScanWebSocketHandler scanWebSocketHandler, ScanProperties properties) {
        this.scanWebSocketHandler = scanWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(scanWebSocketHandler, "/ws/*")
                .setAllowedOrigins(properties.getCors().getAllowedOrigins().toArray(new String[0]));
    }
}

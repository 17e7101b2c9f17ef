package com.numbersgame.puzzleserver;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final PuzzleWebSocketHandler puzzleWebSocketHandler;

    public WebSocketConfig(PuzzleWebSocketHandler puzzleWebSocketHandler) {
        this.puzzleWebSocketHandler = puzzleWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(puzzleWebSocketHandler, "/puzzle-ws")
                .setAllowedOrigins("*");
    }
}

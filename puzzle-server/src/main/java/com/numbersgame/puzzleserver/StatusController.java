package com.numbersgame.puzzleserver;

import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
public class StatusController {

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of(
            "app", "numbers-puzzle",
            "api", "/api/puzzle",
            "websocket", "/puzzle-ws"
        );
    }
}

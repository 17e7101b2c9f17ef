package com.numbersgame.puzzleserver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Interactive play over a WebSocket. Every inbound message is a JSON object with a {@code type}:
 * <ul>
 *   <li>{@code new} – optional {@code num_operands, decoys, show_solution, target_min, target_max,
 *       require_parens_prob}; replies {@code puzzle}</li>
 *   <li>{@code check} – {@code numbers, expression, target?}; replies {@code check_result}</li>
 *   <li>{@code reveal} – {@code round_id}; replies {@code solution}</li>
 *   <li>{@code ping} – replies {@code pong}</li>
 * </ul>
 * Failures are sent back as {@code error} messages; the connection stays open.
 */
@Component
public class PuzzleWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(PuzzleWebSocketHandler.class);

    private final PuzzleService puzzleService;
    private final ObjectMapper objectMapper;
    private final int defaultNumOperands;
    private final int defaultDecoys;
    private final long defaultTargetMin;
    private final long defaultTargetMax;
    private final double defaultRequireParensProb;

    public PuzzleWebSocketHandler(PuzzleService puzzleService,
                                  ObjectMapper objectMapper,
                                  @Value("${puzzle.defaults.num-operands:5}") int defaultNumOperands,
                                  @Value("${puzzle.defaults.decoys:1}") int defaultDecoys,
                                  @Value("${puzzle.defaults.target-min:10}") long defaultTargetMin,
                                  @Value("${puzzle.defaults.target-max:150}") long defaultTargetMax,
                                  @Value("${puzzle.defaults.require-parens-prob:0.6}") double defaultRequireParensProb) {
        this.puzzleService = puzzleService;
        this.objectMapper = objectMapper;
        this.defaultNumOperands = defaultNumOperands;
        this.defaultDecoys = defaultDecoys;
        this.defaultTargetMin = defaultTargetMin;
        this.defaultTargetMax = defaultTargetMax;
        this.defaultRequireParensProb = defaultRequireParensProb;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("WebSocket connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            sendMessage(session, "error", "Message is not valid JSON");
            return;
        }
        String type = node.path("type").asText("");

        try {
            switch (type) {
                case "new":
                    GenerationOptions options = new GenerationOptions(
                            node.path("num_operands").asInt(defaultNumOperands),
                            node.path("decoys").asInt(defaultDecoys),
                            node.path("target_min").asLong(defaultTargetMin),
                            node.path("target_max").asLong(defaultTargetMax),
                            node.path("require_parens_prob").asDouble(defaultRequireParensProb));
                    boolean showSolution = node.path("show_solution").asBoolean(false);
                    sendMessage(session, "puzzle", puzzleService.newPuzzle(options, showSolution));
                    break;

                case "check":
                    sendMessage(session, "check_result", puzzleService.check(node));
                    break;

                case "reveal":
                    String roundId = node.path("round_id").asText(null);
                    sendMessage(session, "solution", Map.of("solution", puzzleService.reveal(roundId)));
                    break;

                case "ping":
                    sendMessage(session, "pong", "Server alive");
                    break;

                default:
                    log.debug("Unknown message type '{}' from {}", type, session.getId());
                    sendMessage(session, "error", "Unknown message type: " + type);
                    break;
            }
        } catch (InvalidParameterException | RoundNotFoundException | GenerationExhaustedException e) {
            sendMessage(session, "error", e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket disconnected: {} status={}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error for {}: {}", session.getId(), exception.getMessage());
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.SERVER_ERROR);
            }
        } catch (IOException e) {
            log.warn("Error closing session {} after transport error", session.getId(), e);
        }
    }

    private void sendMessage(WebSocketSession session, String type, Object data) {
        if (session == null || !session.isOpen()) {
            log.debug("Dropping '{}' message for closed session", type);
            return;
        }
        try {
            Map<String, Object> message = new HashMap<>();
            message.put("type", type);
            message.put("data", data);
            message.put("timestamp", System.currentTimeMillis());
            String json = objectMapper.writeValueAsString(message);
            synchronized (session) {
                if (session.isOpen()) {
                    session.sendMessage(new TextMessage(json));
                }
            }
        } catch (IOException e) {
            log.warn("Failed to send WebSocket message to {}: {}", session.getId(), e.getMessage());
        }
    }
}

package com.numbersgame.puzzleserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-wide registry of generated rounds, keyed by an unguessable id.
 * <p>
 * Rounds expire after the configured time-to-live and the oldest rounds are evicted once the
 * store holds more than {@code maxEntries}. Safe for concurrent use.
 */
@Component
public class RoundStore {

    private static final Logger log = LoggerFactory.getLogger(RoundStore.class);
    private static final int ID_BYTES = 16;

    private final Map<String, StoredRound> rounds = new ConcurrentHashMap<>();
    // Insertion order, used for eviction
    private final Queue<String> order = new ConcurrentLinkedQueue<>();
    private final SecureRandom idSource = new SecureRandom();
    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;

    private record StoredRound(PuzzleRound round, Instant createdAt) {}

    @Autowired
    public RoundStore(Clock clock,
                      @Value("${puzzle.rounds.ttl-minutes:120}") long ttlMinutes,
                      @Value("${puzzle.rounds.max-entries:10000}") int maxEntries) {
        this(clock, Duration.ofMinutes(ttlMinutes), maxEntries);
    }

    public RoundStore(Clock clock, Duration ttl, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
    }

    public String put(PuzzleRound round) {
        StoredRound stored = new StoredRound(round, clock.instant());
        String id;
        do {
            id = newId();
        } while (rounds.putIfAbsent(id, stored) != null);
        order.add(id);
        evict();
        return id;
    }

    public Optional<PuzzleRound> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        StoredRound stored = rounds.get(id);
        if (stored == null) {
            return Optional.empty();
        }
        if (isExpired(stored, clock.instant())) {
            rounds.remove(id, stored);
            return Optional.empty();
        }
        return Optional.of(stored.round());
    }

    public PuzzleRound require(String id) {
        return get(id).orElseThrow(() -> new RoundNotFoundException(id));
    }

    public int size() {
        return rounds.size();
    }

    private void evict() {
        Instant now = clock.instant();
        String head;
        while ((head = order.peek()) != null) {
            StoredRound stored = rounds.get(head);
            boolean drop = stored == null || isExpired(stored, now) || rounds.size() > maxEntries;
            if (!drop) {
                break;
            }
            if (order.remove(head)) {
                if (rounds.remove(head) != null) {
                    log.debug("Evicted round {}", head);
                }
            }
        }
    }

    private boolean isExpired(StoredRound stored, Instant now) {
        return stored.createdAt().plus(ttl).isBefore(now);
    }

    private String newId() {
        byte[] bytes = new byte[ID_BYTES];
        idSource.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}

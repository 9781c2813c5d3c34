package com.schoolsched.schoolsched_api.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory holder of previews and of the state of every generation request.
 * Nothing here is durable: a restart drops all previews.
 */
@Component
public class PreviewStore {

    private static final Logger logger = LoggerFactory.getLogger(PreviewStore.class);

    private final ConcurrentMap<String, SchedulePreview> previews = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, StateEntry> states = new ConcurrentHashMap<>();
    private final Duration timeToLive;
    private final Clock clock;

    @Autowired
    public PreviewStore(@Value("${schedule.preview.ttl-minutes:30}") long ttlMinutes) {
        this(Duration.ofMinutes(ttlMinutes), Clock.systemUTC());
    }

    PreviewStore(Duration timeToLive, Clock clock) {
        this.timeToLive = timeToLive;
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public Instant expiryFromNow() {
        return now().plus(timeToLive);
    }

    /**
     * Registers a new request token as REQUESTED and sweeps expired entries.
     */
    public void begin(String token) {
        evictExpired();
        setState(token, GenerationState.REQUESTED);
    }

    public void put(SchedulePreview preview) {
        evictExpired();
        previews.put(preview.getToken(), preview);
        setState(preview.getToken(), GenerationState.PREVIEW_READY);
    }

    public Optional<SchedulePreview> get(String token) {
        SchedulePreview preview = previews.get(token);
        if (preview == null) {
            return Optional.empty();
        }
        if (preview.isExpired(now())) {
            logger.info("Preview {} expired at {}", token, preview.getExpiresAt());
            previews.remove(token, preview);
            setState(token, GenerationState.DISCARDED);
            return Optional.empty();
        }
        return Optional.of(preview);
    }

    public Optional<SchedulePreview> remove(String token, GenerationState finalState) {
        SchedulePreview removed = previews.remove(token);
        if (removed != null) {
            setState(token, finalState);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Drops a token and its preview without leaving a state behind.
     */
    public void forget(String token) {
        previews.remove(token);
        states.remove(token);
    }

    public void setState(String token, GenerationState state) {
        states.put(token, new StateEntry(state, now()));
    }

    public Optional<GenerationState> getState(String token) {
        return Optional.ofNullable(states.get(token)).map(StateEntry::state);
    }

    public int size() {
        return previews.size();
    }

    public int stateCount() {
        return states.size();
    }

    private void evictExpired() {
        Instant now = now();
        previews.entrySet().removeIf(entry -> {
            if (entry.getValue().isExpired(now)) {
                states.put(entry.getKey(), new StateEntry(GenerationState.DISCARDED, now));
                return true;
            }
            return false;
        });
        // a terminal state is kept for one more TTL so callers can still read it
        Instant cutoff = now.minus(timeToLive);
        states.entrySet().removeIf(entry -> !previews.containsKey(entry.getKey())
                && entry.getValue().updatedAt().isBefore(cutoff));
    }

    private record StateEntry(GenerationState state, Instant updatedAt) {
    }
}

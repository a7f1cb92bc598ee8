package com.example.handoff.service;

import com.example.handoff.domain.QueueStats;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "chat.redis", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LocalQueueStatsCache implements QueueStatsCache {

    private final Clock clock;
    private final AtomicReference<Entry> current = new AtomicReference<>();

    @Override
    public Optional<QueueStats> get() {
        Entry entry = current.get();
        if (entry == null || !Instant.now(clock).isBefore(entry.expiresAt())) {
            return Optional.empty();
        }
        return Optional.of(entry.stats());
    }

    @Override
    public void put(QueueStats stats, Duration ttl) {
        current.set(new Entry(stats, Instant.now(clock).plus(ttl)));
    }

    private record Entry(QueueStats stats, Instant expiresAt) {
    }
}

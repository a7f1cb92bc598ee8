package com.example.handoff.service;

import com.example.handoff.domain.QueueStats;
import java.time.Duration;
import java.util.Optional;

public interface QueueStatsCache {

    Optional<QueueStats> get();

    void put(QueueStats stats, Duration ttl);
}

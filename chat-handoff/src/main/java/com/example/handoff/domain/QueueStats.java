package com.example.handoff.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats implements Serializable {

    private long totalConversations;
    private long active;
    private long waiting;
    private long inProgress;

    /** Waiting plus in progress. */
    private long openTotal;

    private long resolvedToday;

    /** Mean queued-to-claimed latency in seconds, {@code null} without samples. */
    private Double averageResponseSeconds;

    /** Mean queued-to-resolved latency in seconds, {@code null} without samples. */
    private Double averageResolutionSeconds;

    private Instant computedAt;
}

package com.example.handoff.dto;

import java.util.List;

public record IdleSweepResponse(int closed, List<String> conversationIds) {
}

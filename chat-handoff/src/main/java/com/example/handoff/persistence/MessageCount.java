package com.example.handoff.persistence;

public record MessageCount(String conversationId, long count) {
}

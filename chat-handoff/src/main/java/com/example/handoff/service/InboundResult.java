package com.example.handoff.service;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;

/**
 * @param recommendation the draft generated for the turn, or {@code null}
 */
public record InboundResult(Conversation conversation, ChatMessage message, ChatMessage recommendation) {
}

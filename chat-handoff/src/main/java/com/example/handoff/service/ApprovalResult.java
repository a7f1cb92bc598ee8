package com.example.handoff.service;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;

public record ApprovalResult(Conversation conversation, ChatMessage message, int discardedDrafts) {
}

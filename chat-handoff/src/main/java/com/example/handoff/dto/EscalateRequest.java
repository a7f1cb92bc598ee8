package com.example.handoff.dto;

import com.example.handoff.domain.ConversationPriority;
import lombok.Data;

@Data
public class EscalateRequest {

    private ConversationPriority priority;
}

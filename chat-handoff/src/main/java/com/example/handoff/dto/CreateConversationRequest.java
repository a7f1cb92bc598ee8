package com.example.handoff.dto;

import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ServiceMode;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class CreateConversationRequest {

    @NotBlank
    @Size(max = 255)
    private String sessionToken;

    private ServiceMode serviceMode;

    private ConversationPriority priority;

    /**
     * Refuse to open a second conversation while the session already has an open one.
     */
    private boolean exclusiveSession;

    private final Map<String, Object> attributes = new HashMap<>();

    @JsonAnySetter
    public void addAttribute(String key, Object value) {
        attributes.put(key, value);
    }
}

package com.example.handoff.domain;

public enum InputMethod {
    TEXT,
    SPEECH,
    GESTURE,
    LLM_GENERATED
}

package com.example.handoff.service;

import com.example.handoff.domain.OperatorRole;

public record OperatorAccount(String operatorId, OperatorRole role, boolean active) {
}

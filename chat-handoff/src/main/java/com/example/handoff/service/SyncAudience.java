package com.example.handoff.service;

public enum SyncAudience {
    /** The customer sees history only. */
    CUSTOMER,
    /** Operators also see pending recommendation drafts. */
    OPERATOR
}

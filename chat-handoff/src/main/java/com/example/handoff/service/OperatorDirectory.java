package com.example.handoff.service;

import java.util.Optional;

/**
 * Looks up operator accounts by the credential presented with a request.
 */
public interface OperatorDirectory {

    Optional<OperatorAccount> findByCredential(String credential);
}

package com.libragraph.registry.core.transaction;

import java.util.List;

/**
 * Go/no-go decision over a whole transaction.
 *
 * @param messages one {@code "<type> <name>: <result>"} line per rejected asset, each
 *                 followed by that asset's error details; empty when valid
 */
public record TransactionVerdict(boolean valid, List<String> messages) {
    public TransactionVerdict {
        messages = List.copyOf(messages);
    }
}

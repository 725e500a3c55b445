package io.rrproxy.standalone.proxy;

/**
 * Lifecycle of one client request inside {@link ProxyHandler}.
 *
 * <pre>
 * ACCEPTED → READING → DISPATCHED → RELAYING → COMPLETED
 *                          ↑            │
 *                          └─ RETRYING ←┘ (retryable failure, attempts left)
 * any state → FAILED
 * </pre>
 */
public enum ExchangeState {
    ACCEPTED,
    READING,
    DISPATCHED,
    RELAYING,
    RETRYING,
    COMPLETED,
    FAILED
}

package com.optionsbacktester.domain.enums;

/**
 * Lifecycle of a simulated position. CLOSED is terminal: no transition leads back to OPEN.
 */
public enum PositionStatus {
    OPEN,
    CLOSED
}

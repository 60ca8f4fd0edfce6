package com.optionsbacktester.domain.enums;

/**
 * Why a position was closed. Declaration order matches evaluation priority:
 * when several triggers hold on the same bar, the earliest constant wins.
 */
public enum ExitReason {
    PROFIT_TARGET,
    STOP_LOSS,
    TARGET_HOLD_REACHED,
    MAX_HOLD_REACHED,
    /** Forced close of every remaining position after the last bar. */
    END_OF_PERIOD
}

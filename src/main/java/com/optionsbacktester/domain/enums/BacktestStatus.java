package com.optionsbacktester.domain.enums;

public enum BacktestStatus {
    COMPLETED,
    /** Stopped on corrupt bar data; the ledger holds only trades closed before the abort. */
    ABORTED
}

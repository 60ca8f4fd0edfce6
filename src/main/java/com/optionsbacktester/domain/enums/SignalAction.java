package com.optionsbacktester.domain.enums;

public enum SignalAction {
    ENTER,
    HOLD
}

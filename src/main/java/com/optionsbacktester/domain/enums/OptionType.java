package com.optionsbacktester.domain.enums;

/** Option contract right. */
public enum OptionType {
    CALL,
    PUT;

    public boolean isCall() {
        return this == CALL;
    }
}

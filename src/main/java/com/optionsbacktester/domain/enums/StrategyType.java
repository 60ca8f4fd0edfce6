package com.optionsbacktester.domain.enums;

/**
 * Strategy families with a backtesting adapter.
 */
public enum StrategyType {
    /** Call broken-wing butterfly combined with a put diagonal. */
    FLYAGONAL,
    /** Single long call or put bought on a directional signal. */
    MOMENTUM
}

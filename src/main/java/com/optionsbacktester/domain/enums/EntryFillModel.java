package com.optionsbacktester.domain.enums;

/**
 * Price at which a leg is assumed filled when a position opens.
 */
public enum EntryFillModel {
    /** Same price used for marking (last, else mid). Entry and immediate mark agree. */
    MARK,
    /** Buy at the ask, sell at the bid. Starts every position at a spread-sized loss. */
    CROSS_SPREAD
}

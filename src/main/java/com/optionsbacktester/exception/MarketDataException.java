package com.optionsbacktester.exception;

import java.util.Map;

/**
 * A quote provider could not deliver data for a bar. The loop skips the whole bar
 * rather than marking positions on partial data.
 */
public class MarketDataException extends BaseException {

    public MarketDataException(String message) {
        super(ErrorCode.MARKET_DATA_UNAVAILABLE, message);
    }

    public MarketDataException(String message, Map<String, Object> details) {
        super(ErrorCode.MARKET_DATA_UNAVAILABLE, message, details);
    }
}

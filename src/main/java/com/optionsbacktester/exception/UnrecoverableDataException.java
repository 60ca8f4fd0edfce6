package com.optionsbacktester.exception;

import com.optionsbacktester.core.engine.BacktestResult;
import java.util.Map;
import lombok.Getter;

/**
 * The bar stream itself is malformed (non-monotonic timestamps, non-finite or
 * non-positive prices). Fatal for the run.
 *
 * <p>The engine attaches the partial result accumulated before the bad bar so the
 * ledger up to that point can still be inspected.
 */
@Getter
public class UnrecoverableDataException extends BaseException {

    private final transient BacktestResult partialResult;

    public UnrecoverableDataException(String message, Map<String, Object> details) {
        super(ErrorCode.UNRECOVERABLE_DATA, message, details);
        this.partialResult = null;
    }

    private UnrecoverableDataException(String message, Map<String, Object> details, BacktestResult partialResult) {
        super(ErrorCode.UNRECOVERABLE_DATA, message, details);
        this.partialResult = partialResult;
    }

    /** Returns a copy of this exception carrying the run's partial result. */
    public UnrecoverableDataException withPartialResult(BacktestResult result) {
        return new UnrecoverableDataException(getMessage(), getDetails(), result);
    }

    public boolean hasPartialResult() {
        return partialResult != null;
    }
}

package com.optionsbacktester.exception;

import com.optionsbacktester.domain.model.ContractSpec;
import java.util.Map;
import lombok.Getter;

/**
 * A contract required to open a position has no quote in the bar's quote universe.
 *
 * <p>Recoverable: the adapter aborts position creation for that bar only and the
 * loop moves on.
 */
@Getter
public class DataGapException extends BaseException {

    private final ContractSpec missingContract;

    public DataGapException(ContractSpec missingContract) {
        super(
                ErrorCode.DATA_GAP,
                "No quote available for required contract " + missingContract,
                Map.of("contract", missingContract.toString()));
        this.missingContract = missingContract;
    }
}

package com.optionsbacktester.marketdata;

import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.exception.MarketDataException;
import java.util.List;
import java.util.Set;

/**
 * Blocking source of option quotes for one bar.
 *
 * <p>Implementations return at most one quote per contract. Contracts without data are
 * simply absent from the result; a provider that cannot answer for the bar at all
 * throws {@link MarketDataException}.
 */
public interface QuoteProvider {

    /** Stable name used in the provider priority list and in logs. */
    String name();

    /**
     * @param contracts contracts the loop needs at this bar
     * @param bar       the bar being processed
     * @throws MarketDataException when the provider has no data for the bar
     */
    List<OptionQuote> fetch(Set<ContractSpec> contracts, Bar bar);

    /**
     * Whether calls reach an external service and so count against a wall-clock rate
     * limit. In-memory providers return false: a replay's ledger must not depend on how
     * fast the machine runs it.
     */
    default boolean isRateLimited() {
        return false;
    }
}

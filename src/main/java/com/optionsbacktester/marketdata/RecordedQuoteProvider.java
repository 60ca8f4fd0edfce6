package com.optionsbacktester.marketdata;

import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.exception.MarketDataException;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves historical quote snapshots keyed by bar timestamp.
 *
 * <p>Only quotes matching a requested contract (type, strike, expiration within the
 * tolerance) are returned. A bar with no recorded snapshot at all is a
 * {@link MarketDataException}, which lets a fallback provider answer instead.
 */
@Slf4j
public class RecordedQuoteProvider implements QuoteProvider {

    public static final String NAME = "recorded";

    private final Map<LocalDateTime, List<OptionQuote>> snapshots;
    private final int expirationToleranceDays;

    public RecordedQuoteProvider(Map<LocalDateTime, List<OptionQuote>> snapshots, int expirationToleranceDays) {
        this.snapshots = new TreeMap<>(snapshots);
        this.expirationToleranceDays = expirationToleranceDays;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<OptionQuote> fetch(Set<ContractSpec> contracts, Bar bar) {
        List<OptionQuote> snapshot = snapshots.get(bar.getTimestamp());
        if (snapshot == null || snapshot.isEmpty()) {
            throw new MarketDataException(
                    "No recorded quotes at " + bar.getTimestamp(), Map.of("timestamp", bar.getTimestamp().toString()));
        }
        List<OptionQuote> matched = snapshot.stream()
                .filter(q -> requested(q, contracts))
                .toList();
        log.debug("Recorded quotes at {}: {} of {} match {} requested contracts",
                bar.getTimestamp(), matched.size(), snapshot.size(), contracts.size());
        return matched;
    }

    public int snapshotCount() {
        return snapshots.size();
    }

    private boolean requested(OptionQuote quote, Collection<ContractSpec> contracts) {
        for (ContractSpec contract : contracts) {
            if (contract.matches(quote, expirationToleranceDays)) {
                return true;
            }
        }
        return false;
    }
}

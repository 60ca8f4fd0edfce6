package com.optionsbacktester.reporting;

import com.optionsbacktester.config.LedgerConfig;
import com.optionsbacktester.domain.model.Trade;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes the trade ledger as delimited text: one header line, then one line per trade
 * in ledger order.
 *
 * <p>Columns: position_id, strategy, entry_time, exit_time, entry_cost, exit_value,
 * realized_pnl, holding_minutes, exit_reason, regime, estimated. Values containing the
 * delimiter, a quote or a line break are quoted with embedded quotes doubled.
 */
@Component
public class TradeLedgerWriter {

    static final List<String> COLUMNS = List.of(
            "position_id",
            "strategy",
            "entry_time",
            "exit_time",
            "entry_cost",
            "exit_value",
            "realized_pnl",
            "holding_minutes",
            "exit_reason",
            "regime",
            "estimated");

    private final LedgerConfig ledgerConfig;

    public TradeLedgerWriter(LedgerConfig ledgerConfig) {
        this.ledgerConfig = ledgerConfig;
    }

    public void write(List<Trade> trades, Writer out) throws IOException {
        String delimiter = ledgerConfig.getDelimiter();
        out.write(String.join(delimiter, COLUMNS));
        out.write('\n');
        for (Trade trade : trades) {
            out.write(String.join(delimiter, List.of(
                    escape(trade.getPositionId(), delimiter),
                    escape(trade.getStrategyName(), delimiter),
                    String.valueOf(trade.getEntryTime()),
                    String.valueOf(trade.getExitTime()),
                    money(trade.getEntryCost()),
                    money(trade.getExitValue()),
                    money(trade.getRealizedPnl()),
                    String.valueOf(trade.getHoldingMinutes()),
                    String.valueOf(trade.getExitReason()),
                    String.valueOf(trade.getRegimeAtEntry()),
                    String.valueOf(trade.isEstimated()))));
            out.write('\n');
        }
        out.flush();
    }

    public String toDelimitedText(List<Trade> trades) {
        StringWriter out = new StringWriter();
        try {
            write(trades, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render trade ledger", e);
        }
        return out.toString();
    }

    private String money(BigDecimal value) {
        return value == null ? "" : value.setScale(ledgerConfig.getMoneyScale(), RoundingMode.HALF_UP).toPlainString();
    }

    private static String escape(String value, String delimiter) {
        if (value == null) {
            return "";
        }
        if (value.contains(delimiter) || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}

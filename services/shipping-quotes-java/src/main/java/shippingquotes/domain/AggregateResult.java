package shippingquotes.domain;

import java.util.List;

/**
 * Merged quotes in carrier-invocation order plus one warning per failed carrier.
 */
public final class AggregateResult {
    private final List<Quote> quotes;
    private final List<String> warnings;

    public AggregateResult(List<Quote> quotes, List<String> warnings) {
        this.quotes = List.copyOf(quotes);
        this.warnings = List.copyOf(warnings);
    }

    public List<Quote> getQuotes() {
        return quotes;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}

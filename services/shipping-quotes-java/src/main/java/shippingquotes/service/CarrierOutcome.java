package shippingquotes.service;

import java.util.List;

import shippingquotes.domain.Carrier;
import shippingquotes.domain.Quote;

/**
 * Settled result of one carrier pipeline: either quotes or a warning, never both.
 */
final class CarrierOutcome {
    private final Carrier carrier;
    private final List<Quote> quotes;
    private final String warning;

    private CarrierOutcome(Carrier carrier, List<Quote> quotes, String warning) {
        this.carrier = carrier;
        this.quotes = quotes;
        this.warning = warning;
    }

    static CarrierOutcome success(Carrier carrier, List<Quote> quotes) {
        return new CarrierOutcome(carrier, quotes == null ? List.of() : List.copyOf(quotes), null);
    }

    static CarrierOutcome failure(Carrier carrier, String message) {
        return new CarrierOutcome(carrier, List.of(), carrier.getDisplayName() + ": " + message);
    }

    Carrier getCarrier() {
        return carrier;
    }

    boolean isSuccess() {
        return warning == null;
    }

    List<Quote> getQuotes() {
        return quotes;
    }

    String getWarning() {
        return warning;
    }
}

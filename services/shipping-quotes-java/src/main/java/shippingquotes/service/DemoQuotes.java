package shippingquotes.service;

import java.math.BigDecimal;
import java.util.List;

import shippingquotes.domain.Carrier;
import shippingquotes.domain.Quote;

/**
 * Fixed quotes served when carrier credentials are not configured.
 */
final class DemoQuotes {
    static final String NOTE = "demo";

    static final List<Quote> QUOTES = List.of(
            new Quote(Carrier.UPS, "UPS® Ground", new BigDecimal("38.45"), 4, null, NOTE),
            new Quote(Carrier.FEDEX, "FedEx Ground®", new BigDecimal("36.90"), 4, null, NOTE),
            new Quote(Carrier.UPS, "UPS 2nd Day Air®", new BigDecimal("94.20"), 2, null, NOTE),
            new Quote(Carrier.FEDEX, "FedEx 2Day®", new BigDecimal("92.10"), 2, null, NOTE));

    private DemoQuotes() {
    }
}

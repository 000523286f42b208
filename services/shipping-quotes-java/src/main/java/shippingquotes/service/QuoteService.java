package shippingquotes.service;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import shippingquotes.config.CarrierProperties;
import shippingquotes.domain.AggregateResult;
import shippingquotes.domain.Carrier;
import shippingquotes.domain.QuoteRequest;

@Service
public class QuoteService {
    private static final Logger log = LoggerFactory.getLogger(QuoteService.class);

    private final ShipmentSpecNormalizer normalizer;
    private final QuoteAggregator aggregator;
    private final QuotePostProcessor postProcessor;
    private final CarrierProperties props;

    public QuoteService(
            ShipmentSpecNormalizer normalizer,
            QuoteAggregator aggregator,
            QuotePostProcessor postProcessor,
            CarrierProperties props) {
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.postProcessor = postProcessor;
        this.props = props;
    }

    /**
     * Quotes a raw request body.
     *
     * @param onlyHint carrier restriction from outside the body, wins over the body's {@code only}
     * @param demoRequested caller asked for demo quotes
     * @throws NoQuotesException if every selected carrier failed
     */
    public AggregateResult quote(String rawBody, String onlyHint, boolean demoRequested) {
        if (isDemo(demoRequested)) {
            log.info("Serving demo quotes");
            return new AggregateResult(DemoQuotes.QUOTES, List.of());
        }

        QuoteRequest request = normalizer.normalize(rawBody);
        String only = onlyHint != null && !onlyHint.isBlank() ? onlyHint : request.getOnly();
        List<Carrier> carriers = Carrier.select(only);

        AggregateResult merged = aggregator.aggregate(request.getShipment(), carriers);
        return new AggregateResult(
                postProcessor.process(merged.getQuotes(), request.getServiceFilters()),
                merged.getWarnings());
    }

    boolean isDemo(boolean demoRequested) {
        return demoRequested || props.isDemo() || !props.hasAllCredentials();
    }
}

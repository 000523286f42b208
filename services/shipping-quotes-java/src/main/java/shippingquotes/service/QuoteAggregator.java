package shippingquotes.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import shippingquotes.carrier.CarrierClient;
import shippingquotes.config.CarrierProperties;
import shippingquotes.domain.AggregateResult;
import shippingquotes.domain.Carrier;
import shippingquotes.domain.Quote;
import shippingquotes.domain.ShipmentSpec;

/**
 * Fans a shipment out to the selected carriers and merges what comes back.
 *
 * <p>Each carrier runs as its own task and settles into a {@link CarrierOutcome};
 * a failure or timeout in one never cancels or delays collection of another.
 * The merge waits for every task. A carrier that misses the call timeout has its
 * task cancelled, interrupting it if it is already running.
 */
@Service
public class QuoteAggregator {
    private static final Logger log = LoggerFactory.getLogger(QuoteAggregator.class);

    private final Map<Carrier, CarrierClient> clients = new EnumMap<>(Carrier.class);
    private final AsyncTaskExecutor executor;
    private final Duration callTimeout;

    public QuoteAggregator(
            List<CarrierClient> clients,
            @Qualifier("carrierExecutor") AsyncTaskExecutor executor,
            CarrierProperties props) {
        for (CarrierClient c : clients) {
            this.clients.put(c.carrier(), c);
        }
        this.executor = executor;
        this.callTimeout = props.getCallTimeout();
    }

    /**
     * @throws NoQuotesException if no selected carrier produced a quote
     */
    public AggregateResult aggregate(ShipmentSpec spec, List<Carrier> selected) {
        List<CompletableFuture<CarrierOutcome>> pending = new ArrayList<>(selected.size());
        for (Carrier carrier : selected) {
            pending.add(dispatch(carrier, spec));
        }

        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        List<Quote> quotes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (CompletableFuture<CarrierOutcome> f : pending) {
            CarrierOutcome outcome = f.join();
            if (outcome.isSuccess()) {
                quotes.addAll(outcome.getQuotes());
            } else {
                log.warn("Carrier failed: {}", outcome.getWarning());
                warnings.add(outcome.getWarning());
            }
        }

        log.info("Aggregated {} quote(s) from {} carrier(s), {} warning(s)",
                quotes.size(), selected.size(), warnings.size());

        if (quotes.isEmpty()) {
            throw new NoQuotesException(warnings);
        }
        return new AggregateResult(quotes, warnings);
    }

    private CompletableFuture<CarrierOutcome> dispatch(Carrier carrier, ShipmentSpec spec) {
        CarrierClient client = clients.get(carrier);
        if (client == null) {
            return CompletableFuture.completedFuture(CarrierOutcome.failure(carrier, "no client configured"));
        }

        CompletableFuture<List<Quote>> call = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    call.complete(client.getRates(spec));
                } catch (Throwable e) {
                    call.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            // executor rejected the task
            return CompletableFuture.completedFuture(CarrierOutcome.failure(carrier, describe(e)));
        }

        return call
                .orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((quotes, error) -> {
                    if (error == null) {
                        return CarrierOutcome.success(carrier, quotes);
                    }
                    if (error instanceof TimeoutException && task.cancel(true)) {
                        log.debug("{} task cancelled after timeout", carrier);
                    }
                    return CarrierOutcome.failure(carrier, describe(error));
                });
    }

    private String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out after " + callTimeout.toMillis() + " ms";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}

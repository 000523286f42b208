package shippingquotes.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

import shippingquotes.domain.Quote;

/**
 * Applies service-category filters, then orders quotes by total charge.
 */
@Component
public class QuotePostProcessor {

    static final Map<String, List<String>> SERVICE_KEYWORDS = Map.of(
            "ground", List.of("ground", "home delivery"),
            "2day", List.of("2 day", "2day"),
            "overnight", List.of("overnight", "next day", "priority overnight", "standard overnight", "saver"));

    private static final Comparator<Quote> BY_CHARGE = Comparator.comparing(Quote::getTotalCharge);

    /**
     * Keeps quotes matching at least one filter (all quotes when there are no
     * filters) and sorts them ascending by charge. The sort is stable, so equal
     * charges keep carrier-invocation order.
     */
    public List<Quote> process(List<Quote> quotes, List<String> filters) {
        List<Quote> kept = new ArrayList<>(quotes.size());
        for (Quote q : quotes) {
            if (matches(q, filters)) {
                kept.add(q);
            }
        }
        kept.sort(BY_CHARGE);
        return kept;
    }

    static boolean matches(Quote quote, List<String> filters) {
        if (filters == null || filters.isEmpty())
            return true;

        String name = quote.getServiceName() == null ? "" : quote.getServiceName().toLowerCase(Locale.ROOT);
        for (String filter : filters) {
            if (filter == null)
                continue;
            String token = filter.toLowerCase(Locale.ROOT);
            for (String keyword : SERVICE_KEYWORDS.getOrDefault(token, List.of(token))) {
                if (name.contains(keyword))
                    return true;
            }
        }
        return false;
    }
}

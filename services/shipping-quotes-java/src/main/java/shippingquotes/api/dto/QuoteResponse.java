package shippingquotes.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

import shippingquotes.domain.AggregateResult;
import shippingquotes.domain.Quote;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuoteResponse {
    private List<Quote> quotes;
    private List<String> warnings;

    public static QuoteResponse from(AggregateResult result) {
        var r = new QuoteResponse();
        r.quotes = result.getQuotes();
        r.warnings = result.getWarnings().isEmpty() ? null : result.getWarnings();
        return r;
    }

    public List<Quote> getQuotes() {
        return quotes;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}

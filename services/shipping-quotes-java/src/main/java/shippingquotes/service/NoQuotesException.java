package shippingquotes.service;

import java.util.List;

/**
 * Every selected carrier failed. The message is the per-carrier warnings joined
 * with {@code " | "}.
 */
public class NoQuotesException extends RuntimeException {
    static final String SEPARATOR = " | ";

    private final List<String> warnings;

    public NoQuotesException(List<String> warnings) {
        super(warnings.isEmpty() ? "No quotes returned" : String.join(SEPARATOR, warnings));
        this.warnings = List.copyOf(warnings);
    }

    public List<String> getWarnings() {
        return warnings;
    }
}

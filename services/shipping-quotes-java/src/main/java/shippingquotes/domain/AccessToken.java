package shippingquotes.domain;

import java.util.Objects;

/**
 * Bearer token for a single rate call. Never cached or reused.
 */
public final class AccessToken {
    private final String value;

    public AccessToken(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "AccessToken[****]";
    }
}

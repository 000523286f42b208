package shippingquotes.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

public enum Carrier {
    UPS("UPS"),
    FEDEX("FedEx");

    private final String displayName;

    Carrier(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves the carriers to dispatch for an {@code only} hint. A blank or
     * unrecognised hint selects every carrier, in declaration order.
     */
    public static List<Carrier> select(String only) {
        if (only == null || only.isBlank()) {
            return List.of(values());
        }
        var key = only.trim().toLowerCase(Locale.ROOT);
        for (Carrier c : values()) {
            if (c.displayName.toLowerCase(Locale.ROOT).equals(key)) {
                return List.of(c);
            }
        }
        return List.of(values());
    }

    @Override
    public String toString() {
        return displayName;
    }
}

package shippingquotes.carrier;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads FedEx transit tokens such as {@code TWO_DAYS} or {@code ONE_DAY}.
 */
public final class TransitTimeParser {
    private static final Pattern TOKEN = Pattern.compile("(\\w+)_DAYS?");

    private static final Map<String, Integer> CARDINALS = Map.of(
            "ONE", 1,
            "TWO", 2,
            "THREE", 3,
            "FOUR", 4,
            "FIVE", 5,
            "SIX", 6,
            "SEVEN", 7);

    private TransitTimeParser() {
    }

    /**
     * @return days in transit, or {@code null} for any token that is not
     *         {@code ONE..SEVEN} followed by {@code _DAY} or {@code _DAYS}
     */
    public static Integer parseTransit(String token) {
        if (token == null || token.isEmpty())
            return null;
        Matcher m = TOKEN.matcher(token);
        if (!m.find())
            return null;
        return CARDINALS.get(m.group(1));
    }
}

package shippingquotes.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import shippingquotes.domain.Dimensions;
import shippingquotes.domain.InvalidInputException;
import shippingquotes.domain.QuoteRequest;
import shippingquotes.domain.ShipmentSpec;

/**
 * Turns loosely typed caller input into a {@link QuoteRequest}.
 *
 * <p>Nothing is rejected here. A body that is not a JSON object becomes an
 * empty request, and a field that cannot be coerced is simply left unset.
 * Required fields are enforced by each carrier client.
 */
@Component
public class ShipmentSpecNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ShipmentSpecNormalizer.class);

    static final int MAX_INTEGER_DIGITS = 9;
    static final int MAX_FRACTION_DIGITS = 6;

    private final ObjectMapper om;

    public ShipmentSpecNormalizer(ObjectMapper om) {
        this.om = om;
    }

    public QuoteRequest normalize(String rawBody) {
        try {
            return normalize(parse(rawBody));
        } catch (InvalidInputException e) {
            log.warn("Unreadable quote request, continuing with an empty shipment: {}", e.getMessage());
            return QuoteRequest.empty();
        }
    }

    public QuoteRequest normalize(Map<String, ?> input) {
        if (input == null) {
            return QuoteRequest.empty();
        }
        return normalize((JsonNode) om.valueToTree(input));
    }

    public QuoteRequest normalize(JsonNode body) {
        if (body == null || !body.isObject()) {
            return QuoteRequest.empty();
        }

        var spec = ShipmentSpec.builder()
                .originZip(string(body.get("origin_zip")))
                .destZip(string(body.get("dest_zip")))
                .weightLb(decimal(body.get("weight_lb")))
                .dimensions(dimensions(body.get("dimensions_in")))
                .declaredValue(positive(decimal(body.get("declared_value"))))
                .shipDate(date(body.get("ship_date")))
                .residential(bool(body.get("residential")))
                .originState(state(body.get("origin_state")))
                .destState(state(body.get("dest_state")))
                .build();

        return new QuoteRequest(spec, filters(body.get("service_filters")), string(body.get("only")));
    }

    /**
     * @throws InvalidInputException if the body is present but is not a JSON object
     */
    JsonNode parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return om.createObjectNode();
        }
        JsonNode node;
        try {
            node = om.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("malformed JSON body", e);
        }
        if (!node.isObject()) {
            throw new InvalidInputException("expected a JSON object but got " + node.getNodeType());
        }
        return node;
    }

    private static String string(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode())
            return null;
        String s = node.isNumber() ? node.numberValue().toString() : node.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull())
            return null;
        BigDecimal value;
        if (node.isNumber()) {
            if (!Double.isFinite(node.doubleValue())) {
                log.debug("Ignoring non-finite value {}", node);
                return null;
            }
            value = node.decimalValue();
        } else {
            String s = string(node);
            if (s == null)
                return null;
            try {
                value = new BigDecimal(s);
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric value '{}'", s);
                return null;
            }
        }
        return inRange(value);
    }

    /**
     * Integer part at most {@value #MAX_INTEGER_DIGITS} digits, fraction rounded to
     * {@value #MAX_FRACTION_DIGITS} places. Anything finer than that rounds to absent.
     */
    private static BigDecimal inRange(BigDecimal value) {
        if (value.signum() == 0)
            return BigDecimal.ZERO;
        int integerDigits = value.precision() - value.scale();
        if (integerDigits > MAX_INTEGER_DIGITS || integerDigits < -MAX_FRACTION_DIGITS) {
            log.debug("Ignoring out-of-range value {}", value.toString());
            return null;
        }
        return value.scale() > MAX_FRACTION_DIGITS
                ? value.setScale(MAX_FRACTION_DIGITS, RoundingMode.HALF_UP)
                : value;
    }

    private static BigDecimal positive(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : null;
    }

    private static Dimensions dimensions(JsonNode node) {
        if (node == null || !node.isObject())
            return null;
        BigDecimal length = decimal(node.get("length"));
        BigDecimal width = decimal(node.get("width"));
        BigDecimal height = decimal(node.get("height"));
        if (length == null || width == null || height == null) {
            log.debug("Dropping incomplete dimensions {}", node);
            return null;
        }
        return new Dimensions(length, width, height);
    }

    private static LocalDate date(JsonNode node) {
        String s = string(node);
        if (s == null)
            return null;
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable ship_date '{}'", s);
            return null;
        }
    }

    private static boolean bool(JsonNode node) {
        if (node == null || node.isNull())
            return false;
        if (node.isBoolean())
            return node.booleanValue();
        return node.isTextual() && "true".equalsIgnoreCase(node.asText().trim());
    }

    private static String state(JsonNode node) {
        String s = string(node);
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }

    private static List<String> filters(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull())
            return out;
        if (node.isArray()) {
            for (JsonNode f : node) {
                String s = string(f);
                if (s != null)
                    out.add(s);
            }
        } else {
            String s = string(node);
            if (s != null)
                out.add(s);
        }
        return out;
    }
}

package shippingquotes.carrier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import shippingquotes.auth.TokenProvider;
import shippingquotes.config.CarrierCredentials;
import shippingquotes.domain.AccessToken;
import shippingquotes.domain.Quote;
import shippingquotes.domain.ShipmentSpec;

/**
 * Validate, authenticate, post, map. Subclasses supply the payload, the URL and
 * the response mapping.
 */
abstract class AbstractCarrierClient implements CarrierClient {
    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final RestTemplate http;
    protected final ObjectMapper om;
    protected final TokenProvider tokens;
    protected final CarrierCredentials credentials;
    protected final EndpointResolver endpoints;

    protected AbstractCarrierClient(
            RestTemplate http,
            ObjectMapper om,
            TokenProvider tokens,
            CarrierCredentials credentials,
            EndpointResolver endpoints) {
        this.http = http;
        this.om = om;
        this.tokens = tokens;
        this.credentials = credentials;
        this.endpoints = endpoints;
    }

    @Override
    public List<Quote> getRates(ShipmentSpec spec) {
        spec.requireRateable(carrier());

        AccessToken token = tokens.acquireToken(credentials);
        ObjectNode payload = buildPayload(spec);
        String url = rateUrl(endpoints.endpoints());

        log.debug("{} rate request: {}", carrier(), spec);
        JsonNode response = post(url, payload, token);
        List<Quote> quotes = mapResponse(response);
        log.debug("{} returned {} quote(s)", carrier(), quotes.size());
        return quotes;
    }

    protected abstract ObjectNode buildPayload(ShipmentSpec spec);

    protected abstract String rateUrl(CarrierEndpoints endpoints);

    protected abstract List<Quote> mapResponse(JsonNode response);

    private JsonNode post(String url, ObjectNode payload, AccessToken token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(token.getValue());

        ResponseEntity<String> response;
        try {
            response = http.postForEntity(url, new HttpEntity<>(payload.toString(), headers), String.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String body = e.getResponseBodyAsString();
            throw new RateRequestException(carrier(), status, body,
                    carrier().getDisplayName() + " rate error " + status + " " + body, e);
        } catch (RestClientException e) {
            throw new RateRequestException(carrier(), 0, null,
                    carrier().getDisplayName() + " rate error: " + e.getMessage(), e);
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return om.createObjectNode();
        }
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            int status = response.getStatusCode().value();
            throw new RateRequestException(carrier(), status, body,
                    carrier().getDisplayName() + " rate error " + status + " unreadable response", e);
        }
    }

    /**
     * Numeric value of a JSON number or numeric string, or null.
     */
    protected static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return null;
        if (node.isNumber())
            return node.decimalValue();
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    protected static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return null;
        String s = node.asText();
        return s.isEmpty() ? null : s;
    }
}

package shippingquotes.auth;

import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import shippingquotes.carrier.CarrierEndpoints;
import shippingquotes.carrier.EndpointResolver;
import shippingquotes.config.CarrierCredentials;
import shippingquotes.domain.AccessToken;
import shippingquotes.domain.Carrier;

/**
 * Client-credentials grant against a carrier token endpoint.
 *
 * <p>The configured {@link CredentialTransmission}s are tried in order, each at
 * most once, and the first accepted grant wins. Only when every attempt fails is
 * an {@link AuthException} raised, carrying the last upstream status and body.
 */
public class OAuthTokenProvider implements TokenProvider {
    private static final Logger log = LoggerFactory.getLogger(OAuthTokenProvider.class);

    private final Carrier carrier;
    private final RestTemplate http;
    private final Supplier<String> tokenUrl;
    private final List<CredentialTransmission> transmissions;

    public OAuthTokenProvider(
            Carrier carrier,
            RestTemplate http,
            Supplier<String> tokenUrl,
            List<CredentialTransmission> transmissions) {
        if (transmissions.isEmpty()) {
            throw new IllegalArgumentException("at least one credential transmission is required");
        }
        this.carrier = carrier;
        this.http = http;
        this.tokenUrl = tokenUrl;
        this.transmissions = List.copyOf(transmissions);
    }

    /** Basic header only. */
    public static OAuthTokenProvider ups(RestTemplate http, EndpointResolver endpoints) {
        return new OAuthTokenProvider(Carrier.UPS, http,
                () -> endpoints.endpoints().upsTokenUrl(),
                List.of(new BasicHeaderTransmission()));
    }

    /** Basic header, then credentials in the form body. */
    public static OAuthTokenProvider fedex(RestTemplate http, EndpointResolver endpoints) {
        return new OAuthTokenProvider(Carrier.FEDEX, http,
                () -> endpoints.endpoints().fedexTokenUrl(),
                List.of(new BasicHeaderTransmission(), new FormBodyTransmission()));
    }

    @Override
    public AccessToken acquireToken(CarrierCredentials credentials) {
        if (credentials == null || !credentials.isComplete()) {
            throw new AuthException(carrier, carrier.getDisplayName() + " credentials missing");
        }

        String url = tokenUrl.get();
        AuthException last = null;
        for (CredentialTransmission transmission : transmissions) {
            try {
                AccessToken token = attempt(url, transmission, credentials);
                log.debug("{} token acquired via {}", carrier, transmission.name());
                return token;
            } catch (AuthException e) {
                log.debug("{} token attempt via {} failed: status={}", carrier, transmission.name(), e.getStatus());
                if (last != null) {
                    e.addSuppressed(last);
                }
                last = e;
            }
        }
        throw last;
    }

    private AccessToken attempt(String url, CredentialTransmission transmission, CarrierCredentials credentials) {
        ResponseEntity<OAuthTokenResponse> response;
        try {
            response = http.postForEntity(url, transmission.tokenRequest(credentials), OAuthTokenResponse.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String body = e.getResponseBodyAsString();
            throw new AuthException(carrier, status, body,
                    carrier.getDisplayName() + " auth failed " + status + " " + body, e);
        } catch (RestClientException e) {
            throw new AuthException(carrier, 0, null,
                    carrier.getDisplayName() + " auth failed: " + e.getMessage(), e);
        }

        OAuthTokenResponse body = response.getBody();
        if (body == null || body.getAccessToken() == null || body.getAccessToken().isBlank()) {
            int status = response.getStatusCode().value();
            throw new AuthException(carrier, status, null,
                    carrier.getDisplayName() + " auth failed " + status + " no access_token in response", null);
        }
        return new AccessToken(body.getAccessToken());
    }

    public Carrier getCarrier() {
        return carrier;
    }
}

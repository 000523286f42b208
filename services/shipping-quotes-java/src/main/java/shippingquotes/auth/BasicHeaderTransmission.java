package shippingquotes.auth;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import shippingquotes.config.CarrierCredentials;

/**
 * {@code Authorization: Basic base64(id:secret)} with only the grant type in the body.
 */
public class BasicHeaderTransmission implements CredentialTransmission {

    static final String GRANT_BODY = "grant_type=client_credentials";

    @Override
    public String name() {
        return "basic-header";
    }

    @Override
    public HttpEntity<?> tokenRequest(CarrierCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBasicAuth(HttpHeaders.encodeBasicAuth(
                credentials.getClientId(), credentials.getClientSecret(), StandardCharsets.UTF_8));
        return new HttpEntity<>(GRANT_BODY, headers);
    }
}

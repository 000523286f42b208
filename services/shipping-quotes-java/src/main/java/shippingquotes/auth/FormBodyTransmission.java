package shippingquotes.auth;

import java.util.List;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import shippingquotes.config.CarrierCredentials;

/**
 * Client id and secret sent as form fields next to the grant type.
 */
public class FormBodyTransmission implements CredentialTransmission {

    @Override
    public String name() {
        return "form-body";
    }

    @Override
    public HttpEntity<?> tokenRequest(CarrierCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", credentials.getClientId());
        form.add("client_secret", credentials.getClientSecret());
        return new HttpEntity<>(form, headers);
    }
}

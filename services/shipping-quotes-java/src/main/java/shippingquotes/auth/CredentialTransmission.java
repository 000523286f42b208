package shippingquotes.auth;

import org.springframework.http.HttpEntity;

import shippingquotes.config.CarrierCredentials;

/**
 * One way of presenting client credentials to an OAuth token endpoint.
 */
public interface CredentialTransmission {

    String name();

    HttpEntity<?> tokenRequest(CarrierCredentials credentials);
}

package shippingquotes.auth;

import shippingquotes.config.CarrierCredentials;
import shippingquotes.domain.AccessToken;

public interface TokenProvider {

    /**
     * Performs a fresh client-credentials grant.
     *
     * @throws AuthException if credentials are missing or every attempt is rejected
     */
    AccessToken acquireToken(CarrierCredentials credentials);
}

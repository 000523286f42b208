package shippingquotes.auth;

import shippingquotes.domain.Carrier;

/**
 * Credentials were missing or the carrier rejected the client-credentials grant.
 * A status of 0 means no HTTP response was received.
 */
public class AuthException extends RuntimeException {
    private final Carrier carrier;
    private final int status;
    private final String responseBody;

    public AuthException(Carrier carrier, String message) {
        this(carrier, 0, null, message, null);
    }

    public AuthException(Carrier carrier, int status, String responseBody, String message, Throwable cause) {
        super(message, cause);
        this.carrier = carrier;
        this.status = status;
        this.responseBody = responseBody;
    }

    public Carrier getCarrier() {
        return carrier;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}

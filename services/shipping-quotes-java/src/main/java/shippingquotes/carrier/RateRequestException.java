package shippingquotes.carrier;

import shippingquotes.domain.Carrier;

/**
 * The rate endpoint did not return success. A status of 0 means the call never
 * produced an HTTP response.
 */
public class RateRequestException extends RuntimeException {
    private final Carrier carrier;
    private final int status;
    private final String responseBody;

    public RateRequestException(Carrier carrier, int status, String responseBody, String message, Throwable cause) {
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

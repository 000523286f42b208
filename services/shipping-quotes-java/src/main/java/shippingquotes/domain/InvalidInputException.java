package shippingquotes.domain;

/**
 * Raised when caller input cannot be turned into a rateable shipment.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}

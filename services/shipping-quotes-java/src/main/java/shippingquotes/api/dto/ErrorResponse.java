package shippingquotes.api.dto;

public class ErrorResponse {
    private final String error;
    private final String detail;

    public ErrorResponse(String error, String detail) {
        this.error = error;
        this.detail = detail;
    }

    public String getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }
}

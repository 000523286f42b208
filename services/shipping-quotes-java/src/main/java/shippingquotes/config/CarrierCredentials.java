package shippingquotes.config;

/**
 * Client-credentials pair and optional account number for one carrier.
 */
public class CarrierCredentials {
    private String clientId;
    private String clientSecret;
    private String accountNumber;

    public CarrierCredentials() {
    }

    public CarrierCredentials(String clientId, String clientSecret, String accountNumber) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.accountNumber = accountNumber;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public void setAccountNumber(String accountNumber) {
        this.accountNumber = accountNumber;
    }

    public boolean isComplete() {
        return hasText(clientId) && hasText(clientSecret);
    }

    public boolean hasAccountNumber() {
        return hasText(accountNumber);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}

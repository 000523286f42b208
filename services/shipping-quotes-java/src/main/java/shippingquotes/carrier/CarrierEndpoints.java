package shippingquotes.carrier;

/**
 * Base URLs for one deployment mode. FedEx serves auth and rating from one host.
 */
public final class CarrierEndpoints {
    private final String upsAuthHost;
    private final String upsRateHost;
    private final String fedexHost;

    public CarrierEndpoints(String upsAuthHost, String upsRateHost, String fedexHost) {
        this.upsAuthHost = upsAuthHost;
        this.upsRateHost = upsRateHost;
        this.fedexHost = fedexHost;
    }

    public String getUpsAuthHost() {
        return upsAuthHost;
    }

    public String getUpsRateHost() {
        return upsRateHost;
    }

    public String getFedexHost() {
        return fedexHost;
    }

    public String upsTokenUrl() {
        return upsAuthHost + "/security/v1/oauth/token";
    }

    public String upsRateUrl() {
        return upsRateHost + "/api/rating/v2403/Rate";
    }

    public String fedexTokenUrl() {
        return fedexHost + "/oauth/token";
    }

    public String fedexRateUrl() {
        return fedexHost + "/rate/v1/rates/quotes";
    }
}

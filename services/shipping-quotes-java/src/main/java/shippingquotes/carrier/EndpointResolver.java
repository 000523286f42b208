package shippingquotes.carrier;

import shippingquotes.config.DeploymentMode;

public class EndpointResolver {

    static final CarrierEndpoints PRODUCTION = new CarrierEndpoints(
            "https://www.ups.com",
            "https://onlinetools.ups.com",
            "https://apis.fedex.com");

    static final CarrierEndpoints SANDBOX = new CarrierEndpoints(
            "https://wwwcie.ups.com",
            "https://wwwcie.ups.com",
            "https://apis-sandbox.fedex.com");

    private final DeploymentMode mode;

    public EndpointResolver(DeploymentMode mode) {
        this.mode = mode == null ? DeploymentMode.PRODUCTION : mode;
    }

    public static CarrierEndpoints resolve(DeploymentMode mode) {
        return mode == DeploymentMode.SANDBOX ? SANDBOX : PRODUCTION;
    }

    /**
     * Hosts for the mode this process was started with.
     */
    public CarrierEndpoints endpoints() {
        return resolve(mode);
    }

    public DeploymentMode getMode() {
        return mode;
    }
}

package shippingquotes.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import shippingquotes.domain.Carrier;

/**
 * Process-wide carrier settings, bound once at startup from {@code carriers.*}.
 */
@Validated
@ConfigurationProperties(prefix = "carriers")
public class CarrierProperties {

    private String mode = "production";

    private boolean demo;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(15);

    @NotNull
    private Duration callTimeout = Duration.ofSeconds(20);

    private String customerContext = "Shipping Quote";

    @Valid
    private CarrierCredentials ups = new CarrierCredentials();

    @Valid
    private CarrierCredentials fedex = new CarrierCredentials();

    public DeploymentMode getDeploymentMode() {
        return DeploymentMode.from(mode);
    }

    public CarrierCredentials credentialsFor(Carrier carrier) {
        return carrier == Carrier.UPS ? ups : fedex;
    }

    /**
     * True when every carrier has a usable client id and secret.
     */
    public boolean hasAllCredentials() {
        return ups.isComplete() && fedex.isComplete();
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public boolean isDemo() {
        return demo;
    }

    public void setDemo(boolean demo) {
        this.demo = demo;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public String getCustomerContext() {
        return customerContext;
    }

    public void setCustomerContext(String customerContext) {
        this.customerContext = customerContext;
    }

    public CarrierCredentials getUps() {
        return ups;
    }

    public void setUps(CarrierCredentials ups) {
        this.ups = ups;
    }

    public CarrierCredentials getFedex() {
        return fedex;
    }

    public void setFedex(CarrierCredentials fedex) {
        this.fedex = fedex;
    }
}

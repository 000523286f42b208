package shippingquotes.config;

import java.util.Locale;

public enum DeploymentMode {
    SANDBOX,
    PRODUCTION;

    /**
     * Parses a mode flag. Anything other than {@code sandbox} is production.
     */
    public static DeploymentMode from(String value) {
        if (value != null && "sandbox".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return SANDBOX;
        }
        return PRODUCTION;
    }
}

package shippingquotes.service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import shippingquotes.auth.AuthException;
import shippingquotes.auth.TokenProvider;
import shippingquotes.config.CarrierCredentials;
import shippingquotes.config.CarrierProperties;
import shippingquotes.domain.Carrier;

/**
 * Reports credential presence and probes each carrier's OAuth endpoint once.
 */
@Service
public class DiagnosticsService {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsService.class);

    private final CarrierProperties props;
    private final TokenProvider upsTokens;
    private final TokenProvider fedexTokens;

    public DiagnosticsService(
            CarrierProperties props,
            @Qualifier("upsTokenProvider") TokenProvider upsTokens,
            @Qualifier("fedexTokenProvider") TokenProvider fedexTokens) {
        this.props = props;
        this.upsTokens = upsTokens;
        this.fedexTokens = fedexTokens;
    }

    public Map<String, Object> run() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("mode", props.getDeploymentMode().name().toLowerCase(Locale.ROOT));
        out.put("env", credentialPresence());
        out.put("upsAuth", probe(Carrier.UPS, upsTokens));
        out.put("fedexAuth", probe(Carrier.FEDEX, fedexTokens));
        return out;
    }

    private Map<String, Boolean> credentialPresence() {
        CarrierCredentials ups = props.getUps();
        CarrierCredentials fedex = props.getFedex();
        Map<String, Boolean> env = new LinkedHashMap<>();
        env.put("UPS_CLIENT_ID", present(ups.getClientId()));
        env.put("UPS_CLIENT_SECRET", present(ups.getClientSecret()));
        env.put("UPS_ACCOUNT_NUMBER", present(ups.getAccountNumber()));
        env.put("FEDEX_CLIENT_ID", present(fedex.getClientId()));
        env.put("FEDEX_CLIENT_SECRET", present(fedex.getClientSecret()));
        env.put("FEDEX_ACCOUNT_NUMBER", present(fedex.getAccountNumber()));
        return env;
    }

    private Map<String, Object> probe(Carrier carrier, TokenProvider tokens) {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            tokens.acquireToken(props.credentialsFor(carrier));
            result.put("ok", true);
            result.put("status", 200);
        } catch (AuthException e) {
            log.warn("{} auth probe failed: {}", carrier, e.getMessage());
            result.put("ok", false);
            if (e.getStatus() > 0) {
                result.put("status", e.getStatus());
            }
            result.put("error", e.getMessage());
        }
        return result;
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}

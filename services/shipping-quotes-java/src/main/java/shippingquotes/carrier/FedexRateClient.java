package shippingquotes.carrier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.web.client.RestTemplate;

import shippingquotes.auth.TokenProvider;
import shippingquotes.config.CarrierCredentials;
import shippingquotes.domain.Carrier;
import shippingquotes.domain.Quote;
import shippingquotes.domain.ShipmentSpec;

/**
 * FedEx Rate and Transit Times API.
 */
public class FedexRateClient extends AbstractCarrierClient {

    static final String PICKUP_DROPOFF = "DROPOFF_AT_FEDEX_LOCATION";

    public FedexRateClient(
            RestTemplate http,
            ObjectMapper om,
            TokenProvider tokens,
            CarrierCredentials credentials,
            EndpointResolver endpoints) {
        super(http, om, tokens, credentials, endpoints);
    }

    @Override
    public Carrier carrier() {
        return Carrier.FEDEX;
    }

    @Override
    protected String rateUrl(CarrierEndpoints endpoints) {
        return endpoints.fedexRateUrl();
    }

    @Override
    protected ObjectNode buildPayload(ShipmentSpec spec) {
        ObjectNode root = om.createObjectNode();
        root.putObject("accountNumber")
                .put("value", credentials.hasAccountNumber() ? credentials.getAccountNumber() : "");

        ObjectNode requested = root.putObject("requestedShipment");

        ObjectNode shipperAddress = requested.putObject("shipper").putObject("address");
        shipperAddress.put("postalCode", spec.getOriginZip().orElseThrow());
        spec.getOriginState().ifPresent(s -> shipperAddress.put("stateOrProvinceCode", s));
        shipperAddress.put("countryCode", "US");

        ObjectNode recipientAddress = requested.putObject("recipient").putObject("address");
        recipientAddress.put("postalCode", spec.getDestZip().orElseThrow());
        spec.getDestState().ifPresent(s -> recipientAddress.put("stateOrProvinceCode", s));
        recipientAddress.put("countryCode", "US");
        recipientAddress.put("residential", spec.isResidential());

        requested.put("pickupType", PICKUP_DROPOFF);
        requested.putArray("rateRequestType").add("ACCOUNT").add("LIST");

        ObjectNode item = requested.putArray("requestedPackageLineItems").addObject();
        item.putObject("weight")
                .put("units", "LB")
                .put("value", spec.getWeightLb().orElseThrow().doubleValue());

        spec.getDimensions().ifPresent(d -> item.putObject("dimensions")
                .put("length", d.getLength().doubleValue())
                .put("width", d.getWidth().doubleValue())
                .put("height", d.getHeight().doubleValue())
                .put("units", "IN"));

        spec.getDeclaredValue().ifPresent(v -> item.putObject("declaredValue")
                .put("currency", "USD")
                .put("amount", v.doubleValue()));

        spec.getShipDate().ifPresent(date -> requested.put("shipDateStamp", date.toString()));

        return root;
    }

    @Override
    protected List<Quote> mapResponse(JsonNode response) {
        JsonNode details = response.path("output").path("rateReplyDetails");
        List<Quote> quotes = new ArrayList<>();
        if (!details.isArray()) {
            return quotes;
        }

        for (JsonNode d : details) {
            String name = text(d.path("serviceName"));
            if (name == null) {
                name = text(d.path("serviceType"));
            }

            JsonNode commit = d.path("commit");
            String delivery = text(commit.path("dateDetail").path("dayFormat"));
            if (delivery == null) {
                delivery = text(commit.path("datesOrTimes").path(0).path("dateOrTimestamp"));
            }

            String transit = text(commit.path("transitTime"));
            if (transit == null) {
                transit = text(d.path("transitTime"));
            }

            quotes.add(new Quote(Carrier.FEDEX, name, netCharge(d), TransitTimeParser.parseTransit(transit), delivery));
        }
        return quotes;
    }

    private static BigDecimal netCharge(JsonNode detail) {
        JsonNode rated = detail.path("ratedShipmentDetails").path(0);
        BigDecimal amount = amount(rated.path("totalNetCharge"));
        if (amount == null) {
            amount = amount(rated.path("shipmentRateDetail").path("totalNetChargeWithDutiesAndTaxes"));
        }
        return amount == null ? BigDecimal.ZERO : amount;
    }

    // FedEx sends either a bare number or {"amount": n, "currency": ...}
    private static BigDecimal amount(JsonNode charge) {
        if (charge.isObject()) {
            return decimal(charge.path("amount"));
        }
        return decimal(charge);
    }
}

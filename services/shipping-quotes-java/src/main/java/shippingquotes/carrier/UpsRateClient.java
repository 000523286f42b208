package shippingquotes.carrier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
 * UPS Rating API v2403.
 */
public class UpsRateClient extends AbstractCarrierClient {

    static final String PACKAGING_CUSTOMER_SUPPLIED = "02";
    static final String BILL_TYPE_NON_DOCUMENT = "03";

    private static final BigDecimal MAX_DAYS = BigDecimal.valueOf(Integer.MAX_VALUE);
    private static final BigDecimal MIN_DAYS = BigDecimal.valueOf(Integer.MIN_VALUE);

    private final String customerContext;

    public UpsRateClient(
            RestTemplate http,
            ObjectMapper om,
            TokenProvider tokens,
            CarrierCredentials credentials,
            EndpointResolver endpoints,
            String customerContext) {
        super(http, om, tokens, credentials, endpoints);
        this.customerContext = customerContext;
    }

    @Override
    public Carrier carrier() {
        return Carrier.UPS;
    }

    @Override
    protected String rateUrl(CarrierEndpoints endpoints) {
        return endpoints.upsRateUrl();
    }

    @Override
    protected ObjectNode buildPayload(ShipmentSpec spec) {
        ObjectNode root = om.createObjectNode();
        ObjectNode rateRequest = root.putObject("RateRequest");
        rateRequest.putObject("Request")
                .putObject("TransactionReference")
                .put("CustomerContext", customerContext);

        ObjectNode shipment = rateRequest.putObject("Shipment");

        ObjectNode shipper = shipment.putObject("Shipper");
        if (credentials.hasAccountNumber()) {
            shipper.put("ShipperNumber", credentials.getAccountNumber());
        }
        address(shipper, spec.getOriginZip().orElseThrow(), spec.getOriginState().orElse(null));
        address(shipment.putObject("ShipFrom"), spec.getOriginZip().orElseThrow(), spec.getOriginState().orElse(null));

        ObjectNode shipToAddress = address(shipment.putObject("ShipTo"),
                spec.getDestZip().orElseThrow(), spec.getDestState().orElse(null));
        if (spec.isResidential()) {
            shipToAddress.put("ResidentialAddressIndicator", "");
        }

        ObjectNode pkg = shipment.putArray("Package").addObject();
        pkg.putObject("PackagingType").put("Code", PACKAGING_CUSTOMER_SUPPLIED);
        ObjectNode weight = pkg.putObject("PackageWeight");
        weight.putObject("UnitOfMeasurement").put("Code", "LBS");
        weight.put("Weight", plain(spec.getWeightLb().orElseThrow()));

        spec.getDimensions().ifPresent(d -> {
            ObjectNode dims = pkg.putObject("Dimensions");
            dims.putObject("UnitOfMeasurement").put("Code", "IN");
            dims.put("Length", plain(d.getLength()));
            dims.put("Width", plain(d.getWidth()));
            dims.put("Height", plain(d.getHeight()));
        });

        spec.getDeclaredValue().ifPresent(v -> pkg.putObject("PackageServiceOptions")
                .putObject("DeclaredValue")
                .put("CurrencyCode", "USD")
                .put("MonetaryValue", plain(v)));

        shipment.putObject("ShipmentRatingOptions").put("RateChartIndicator", "");

        spec.getShipDate().ifPresent(date -> {
            ObjectNode delivery = shipment.putObject("DeliveryTimeInformation");
            delivery.put("PackageBillType", BILL_TYPE_NON_DOCUMENT);
            delivery.putObject("Pickup").put("Date", date.toString().replace("-", ""));
        });

        return root;
    }

    private static ObjectNode address(ObjectNode party, String postalCode, String state) {
        ObjectNode address = party.putObject("Address");
        address.put("PostalCode", postalCode);
        if (state != null) {
            address.put("StateProvinceCode", state);
        }
        address.put("CountryCode", "US");
        return address;
    }

    @Override
    protected List<Quote> mapResponse(JsonNode response) {
        JsonNode rated = response.path("RateResponse").path("RatedShipment");
        List<JsonNode> shipments = new ArrayList<>();
        if (rated.isArray()) {
            ((ArrayNode) rated).forEach(shipments::add);
        } else if (rated.isObject()) {
            // single-service responses come back as a bare object
            shipments.add(rated);
        }

        List<Quote> quotes = new ArrayList<>(shipments.size());
        for (JsonNode s : shipments) {
            JsonNode service = s.path("Service");
            String name = text(service.path("Description"));
            if (name == null) {
                name = text(service.path("Code"));
            }

            BigDecimal charge = decimal(s.path("TotalCharges").path("MonetaryValue"));

            Integer transitDays = null;
            String deliveryDate = null;
            JsonNode guaranteed = s.path("GuaranteedDelivery");
            if (guaranteed.isObject()) {
                transitDays = wholeDays(decimal(guaranteed.path("BusinessDaysInTransit")));
                deliveryDate = text(guaranteed.path("DeliveryDate"));
            }

            quotes.add(new Quote(Carrier.UPS, name, charge == null ? BigDecimal.ZERO : charge,
                    transitDays, deliveryDate));
        }
        return quotes;
    }

    /**
     * Null unless {@code days} is a whole number that fits an int.
     */
    static Integer wholeDays(BigDecimal days) {
        if (days == null || days.stripTrailingZeros().scale() > 0)
            return null;
        if (days.compareTo(MAX_DAYS) > 0 || days.compareTo(MIN_DAYS) < 0)
            return null;
        return days.intValue();
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}

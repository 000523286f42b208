package shippingquotes.domain;

import java.util.List;

/**
 * A normalized inbound quote request: the shipment plus the caller's
 * post-processing and routing options.
 */
public final class QuoteRequest {
    private final ShipmentSpec shipment;
    private final List<String> serviceFilters;
    private final String only;

    public QuoteRequest(ShipmentSpec shipment, List<String> serviceFilters, String only) {
        this.shipment = shipment;
        this.serviceFilters = List.copyOf(serviceFilters);
        this.only = only;
    }

    public static QuoteRequest empty() {
        return new QuoteRequest(ShipmentSpec.empty(), List.of(), null);
    }

    public ShipmentSpec getShipment() {
        return shipment;
    }

    public List<String> getServiceFilters() {
        return serviceFilters;
    }

    public String getOnly() {
        return only;
    }
}

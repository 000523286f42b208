package shippingquotes.carrier;

import java.util.List;

import shippingquotes.domain.Carrier;
import shippingquotes.domain.Quote;
import shippingquotes.domain.ShipmentSpec;

public interface CarrierClient {

    Carrier carrier();

    /**
     * Acquires a token, then rates the shipment.
     *
     * @throws shippingquotes.domain.InvalidInputException if the shipment lacks
     *         postal codes or weight
     * @throws shippingquotes.auth.AuthException if the token grant fails
     * @throws RateRequestException if the rate endpoint does not return success
     */
    List<Quote> getRates(ShipmentSpec spec);
}

package shippingquotes.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Carrier-agnostic price and transit record. Charges are USD.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Quote {
    private final Carrier carrier;
    private final String serviceName;
    private final BigDecimal totalCharge;
    private final Integer transitDays;
    private final String estimatedDeliveryDate;
    private final String notes;

    public Quote(Carrier carrier, String serviceName, BigDecimal totalCharge, Integer transitDays,
            String estimatedDeliveryDate) {
        this(carrier, serviceName, totalCharge, transitDays, estimatedDeliveryDate, null);
    }

    public Quote(Carrier carrier, String serviceName, BigDecimal totalCharge, Integer transitDays,
            String estimatedDeliveryDate, String notes) {
        this.carrier = Objects.requireNonNull(carrier, "carrier");
        this.serviceName = serviceName;
        this.totalCharge = totalCharge == null || totalCharge.signum() < 0 ? BigDecimal.ZERO : totalCharge;
        this.transitDays = transitDays != null && transitDays > 0 ? transitDays : null;
        this.estimatedDeliveryDate = estimatedDeliveryDate;
        this.notes = notes;
    }

    @JsonProperty("carrier")
    public Carrier getCarrier() {
        return carrier;
    }

    @JsonProperty("service_name")
    public String getServiceName() {
        return serviceName;
    }

    @JsonProperty("total_charge")
    public BigDecimal getTotalCharge() {
        return totalCharge;
    }

    @JsonProperty("transit_days")
    public Integer getTransitDays() {
        return transitDays;
    }

    @JsonProperty("estimated_delivery_date")
    public String getEstimatedDeliveryDate() {
        return estimatedDeliveryDate;
    }

    @JsonProperty("notes")
    public String getNotes() {
        return notes;
    }

    @Override
    public String toString() {
        return carrier + " " + serviceName + " $" + totalCharge.toPlainString()
                + (transitDays != null ? " (" + transitDays + "d)" : "");
    }
}

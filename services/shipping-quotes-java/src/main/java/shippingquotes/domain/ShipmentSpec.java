package shippingquotes.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Canonical description of one shipment to be rated.
 *
 * <p>Every field is optional at this level: origin zip, destination zip and
 * weight are only enforced by the carrier clients, right before they call out,
 * so that a bad field fails each carrier separately instead of the whole request.
 */
public final class ShipmentSpec {
    private static final ShipmentSpec EMPTY = builder().build();

    private final String originZip;
    private final String destZip;
    private final BigDecimal weightLb;
    private final Dimensions dimensions;
    private final BigDecimal declaredValue;
    private final LocalDate shipDate;
    private final boolean residential;
    private final String originState;
    private final String destState;

    private ShipmentSpec(Builder b) {
        this.originZip = b.originZip;
        this.destZip = b.destZip;
        this.weightLb = b.weightLb;
        this.dimensions = b.dimensions;
        this.declaredValue = b.declaredValue;
        this.shipDate = b.shipDate;
        this.residential = b.residential;
        this.originState = b.originState;
        this.destState = b.destState;
    }

    public static ShipmentSpec empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getOriginZip() {
        return Optional.ofNullable(originZip);
    }

    public Optional<String> getDestZip() {
        return Optional.ofNullable(destZip);
    }

    public Optional<BigDecimal> getWeightLb() {
        return Optional.ofNullable(weightLb);
    }

    public Optional<Dimensions> getDimensions() {
        return Optional.ofNullable(dimensions);
    }

    public Optional<BigDecimal> getDeclaredValue() {
        return Optional.ofNullable(declaredValue);
    }

    public Optional<LocalDate> getShipDate() {
        return Optional.ofNullable(shipDate);
    }

    public boolean isResidential() {
        return residential;
    }

    public Optional<String> getOriginState() {
        return Optional.ofNullable(originState);
    }

    public Optional<String> getDestState() {
        return Optional.ofNullable(destState);
    }

    /**
     * Fails with {@link InvalidInputException} unless both postal codes and the
     * weight are present.
     */
    public void requireRateable(Carrier carrier) {
        var missing = new StringBuilder();
        if (originZip == null)
            missing.append("origin_zip ");
        if (destZip == null)
            missing.append("dest_zip ");
        if (weightLb == null)
            missing.append("weight_lb ");
        if (missing.length() > 0) {
            throw new InvalidInputException(
                    carrier.getDisplayName() + " request incomplete, missing " + missing.toString().trim());
        }
    }

    @Override
    public String toString() {
        return "ShipmentSpec{" + originZip + " -> " + destZip + ", " + weightLb + " lb"
                + (dimensions != null ? ", " + dimensions : "")
                + (residential ? ", residential" : "") + "}";
    }

    public static final class Builder {
        private String originZip;
        private String destZip;
        private BigDecimal weightLb;
        private Dimensions dimensions;
        private BigDecimal declaredValue;
        private LocalDate shipDate;
        private boolean residential;
        private String originState;
        private String destState;

        private Builder() {
        }

        public Builder originZip(String originZip) {
            this.originZip = originZip;
            return this;
        }

        public Builder destZip(String destZip) {
            this.destZip = destZip;
            return this;
        }

        public Builder weightLb(BigDecimal weightLb) {
            this.weightLb = weightLb;
            return this;
        }

        public Builder dimensions(Dimensions dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        public Builder declaredValue(BigDecimal declaredValue) {
            this.declaredValue = declaredValue;
            return this;
        }

        public Builder shipDate(LocalDate shipDate) {
            this.shipDate = shipDate;
            return this;
        }

        public Builder residential(boolean residential) {
            this.residential = residential;
            return this;
        }

        public Builder originState(String originState) {
            this.originState = originState;
            return this;
        }

        public Builder destState(String destState) {
            this.destState = destState;
            return this;
        }

        public ShipmentSpec build() {
            return new ShipmentSpec(this);
        }
    }
}

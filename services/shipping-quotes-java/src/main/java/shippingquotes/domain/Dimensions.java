package shippingquotes.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Package dimensions in inches.
 */
public final class Dimensions {
    private final BigDecimal length;
    private final BigDecimal width;
    private final BigDecimal height;

    public Dimensions(BigDecimal length, BigDecimal width, BigDecimal height) {
        this.length = Objects.requireNonNull(length, "length");
        this.width = Objects.requireNonNull(width, "width");
        this.height = Objects.requireNonNull(height, "height");
    }

    public BigDecimal getLength() {
        return length;
    }

    public BigDecimal getWidth() {
        return width;
    }

    public BigDecimal getHeight() {
        return height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Dimensions))
            return false;
        Dimensions other = (Dimensions) o;
        return length.compareTo(other.length) == 0
                && width.compareTo(other.width) == 0
                && height.compareTo(other.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(length.stripTrailingZeros(), width.stripTrailingZeros(), height.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return length.toPlainString() + "x" + width.toPlainString() + "x" + height.toPlainString() + " in";
    }
}

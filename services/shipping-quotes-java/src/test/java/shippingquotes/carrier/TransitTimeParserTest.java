package shippingquotes.carrier;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TransitTimeParserTest {

    @Test
    void cardinalWordsMapToDays() {
        assertThat(TransitTimeParser.parseTransit("ONE_DAY")).isEqualTo(1);
        assertThat(TransitTimeParser.parseTransit("TWO_DAYS")).isEqualTo(2);
        assertThat(TransitTimeParser.parseTransit("SEVEN_DAYS")).isEqualTo(7);
    }

    @Test
    void otherShapesAreUnset() {
        assertThat(TransitTimeParser.parseTransit("NEXT_DAY")).isNull();
        assertThat(TransitTimeParser.parseTransit("EIGHT_DAYS")).isNull();
        assertThat(TransitTimeParser.parseTransit("two_days")).isNull();
        assertThat(TransitTimeParser.parseTransit("UNKNOWN")).isNull();
        assertThat(TransitTimeParser.parseTransit("")).isNull();
        assertThat(TransitTimeParser.parseTransit(null)).isNull();
    }
}

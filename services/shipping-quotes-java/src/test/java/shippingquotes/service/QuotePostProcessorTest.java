package shippingquotes.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

import shippingquotes.domain.Carrier;
import shippingquotes.domain.Quote;

class QuotePostProcessorTest {

    private final QuotePostProcessor processor = new QuotePostProcessor();

    @Test
    void withoutFiltersSortsAscendingByCharge() {
        var result = processor.process(List.of(
                quote(Carrier.UPS, "UPS 2nd Day Air", "94.20"),
                quote(Carrier.FEDEX, "FedEx Ground", "36.90"),
                quote(Carrier.UPS, "UPS Ground", "38.45")), List.of());

        assertThat(result).extracting(Quote::getServiceName)
                .containsExactly("FedEx Ground", "UPS Ground", "UPS 2nd Day Air");
        for (int i = 0; i + 1 < result.size(); i++) {
            assertThat(result.get(i).getTotalCharge()).isLessThanOrEqualTo(result.get(i + 1).getTotalCharge());
        }
    }

    @Test
    void sortIsNumericNotLexical() {
        var result = processor.process(List.of(
                quote(Carrier.UPS, "a", "100.00"),
                quote(Carrier.UPS, "b", "9.5")), null);

        assertThat(result).extracting(Quote::getServiceName).containsExactly("b", "a");
    }

    @Test
    void equalChargesKeepInvocationOrder() {
        var ups = quote(Carrier.UPS, "UPS Ground", "20.00");
        var fedex = quote(Carrier.FEDEX, "FedEx Ground", "20");

        assertThat(processor.process(List.of(ups, fedex), List.of())).containsExactly(ups, fedex);
    }

    @Test
    void overnightKeepsPriorityOvernightAndDropsGround() {
        var result = processor.process(List.of(
                quote(Carrier.FEDEX, "FedEx Priority Overnight", "88.00"),
                quote(Carrier.UPS, "UPS Ground", "12.00")), List.of("overnight"));

        assertThat(result).extracting(Quote::getServiceName).containsExactly("FedEx Priority Overnight");
    }

    @Test
    void keywordTableIsCaseInsensitive() {
        var quotes = List.of(
                quote(Carrier.FEDEX, "FedEx Home Delivery", "15.00"),
                quote(Carrier.FEDEX, "FedEx 2Day", "40.00"),
                quote(Carrier.UPS, "UPS 2 Day Air", "42.00"),
                quote(Carrier.UPS, "UPS Next Day Air Saver", "70.00"));

        assertThat(processor.process(quotes, List.of("GROUND")))
                .extracting(Quote::getServiceName).containsExactly("FedEx Home Delivery");
        assertThat(processor.process(quotes, List.of("2day")))
                .extracting(Quote::getServiceName).containsExactly("FedEx 2Day", "UPS 2 Day Air");
        assertThat(processor.process(quotes, List.of("Overnight")))
                .extracting(Quote::getServiceName).containsExactly("UPS Next Day Air Saver");
    }

    @Test
    void unknownFilterMatchesAsLiteralSubstring() {
        var result = processor.process(List.of(
                quote(Carrier.UPS, "UPS Worldwide Express", "120.00"),
                quote(Carrier.UPS, "UPS Ground", "12.00")), List.of("Express"));

        assertThat(result).extracting(Quote::getServiceName).containsExactly("UPS Worldwide Express");
    }

    @Test
    void quoteIsKeptWhenAnyFilterMatches() {
        var result = processor.process(List.of(
                quote(Carrier.UPS, "UPS Ground", "12.00"),
                quote(Carrier.FEDEX, "FedEx Standard Overnight", "60.00"),
                quote(Carrier.FEDEX, "FedEx 2Day", "30.00")), List.of("ground", "overnight"));

        assertThat(result).extracting(Quote::getServiceName)
                .containsExactly("UPS Ground", "FedEx Standard Overnight");
    }

    @Test
    void missingServiceNameNeverMatchesAFilter() {
        assertThat(processor.process(List.of(quote(Carrier.UPS, null, "1")), List.of("ground"))).isEmpty();
    }

    private static Quote quote(Carrier carrier, String name, String charge) {
        return new Quote(carrier, name, new BigDecimal(charge), null, null);
    }
}

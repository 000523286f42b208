package shippingquotes.carrier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import shippingquotes.auth.AuthException;
import shippingquotes.auth.TokenProvider;
import shippingquotes.config.CarrierCredentials;
import shippingquotes.config.DeploymentMode;
import shippingquotes.domain.AccessToken;
import shippingquotes.domain.Carrier;
import shippingquotes.domain.Dimensions;
import shippingquotes.domain.InvalidInputException;
import shippingquotes.domain.Quote;
import shippingquotes.domain.ShipmentSpec;

class UpsRateClientTest {

    private static final String RATE_URL = "https://onlinetools.ups.com/api/rating/v2403/Rate";

    MockRestServiceServer server;
    TokenProvider tokens;
    UpsRateClient client;

    @BeforeEach
    void setUp() {
        var http = new RestTemplate();
        server = MockRestServiceServer.bindTo(http).build();
        tokens = mock(TokenProvider.class);
        client = new UpsRateClient(http, new ObjectMapper(), tokens,
                new CarrierCredentials("id", "secret", "A1B2C3"),
                new EndpointResolver(DeploymentMode.PRODUCTION), "Shipping Quote");
    }

    @Test
    void buildsFullRateRequestAndMapsGuaranteedDelivery() {
        when(tokens.acquireToken(any())).thenReturn(new AccessToken("ups-token"));

        server.expect(requestTo(RATE_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer ups-token"))
                .andExpect(jsonPath("$.RateRequest.Request.TransactionReference.CustomerContext").value("Shipping Quote"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Shipper.ShipperNumber").value("A1B2C3"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Shipper.Address.PostalCode").value("10001"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Shipper.Address.StateProvinceCode").value("NY"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Shipper.Address.CountryCode").value("US"))
                .andExpect(jsonPath("$.RateRequest.Shipment.ShipFrom.Address.PostalCode").value("10001"))
                .andExpect(jsonPath("$.RateRequest.Shipment.ShipTo.Address.PostalCode").value("94105"))
                .andExpect(jsonPath("$.RateRequest.Shipment.ShipTo.Address.ResidentialAddressIndicator").value(""))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].PackagingType.Code").value("02"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].PackageWeight.UnitOfMeasurement.Code").value("LBS"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].PackageWeight.Weight").value("12.5"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].Dimensions.UnitOfMeasurement.Code").value("IN"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].Dimensions.Length").value("10"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].Dimensions.Height").value("4"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].PackageServiceOptions.DeclaredValue.CurrencyCode").value("USD"))
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].PackageServiceOptions.DeclaredValue.MonetaryValue").value("250"))
                .andExpect(jsonPath("$.RateRequest.Shipment.ShipmentRatingOptions.RateChartIndicator").value(""))
                .andExpect(jsonPath("$.RateRequest.Shipment.DeliveryTimeInformation.PackageBillType").value("03"))
                .andExpect(jsonPath("$.RateRequest.Shipment.DeliveryTimeInformation.Pickup.Date").value("20240315"))
                .andRespond(withSuccess("""
                        {"RateResponse":{"RatedShipment":[
                          {"Service":{"Code":"03","Description":"UPS Ground"},
                           "TotalCharges":{"CurrencyCode":"USD","MonetaryValue":"21.37"}},
                          {"Service":{"Code":"02"},
                           "TotalCharges":{"CurrencyCode":"USD","MonetaryValue":"48.10"},
                           "GuaranteedDelivery":{"BusinessDaysInTransit":"2","DeliveryDate":"20240319"}}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        var spec = ShipmentSpec.builder()
                .originZip("10001")
                .originState("NY")
                .destZip("94105")
                .weightLb(new BigDecimal("12.50"))
                .dimensions(new Dimensions(new BigDecimal("10"), new BigDecimal("8"), new BigDecimal("4")))
                .declaredValue(new BigDecimal("250.00"))
                .shipDate(LocalDate.of(2024, 3, 15))
                .residential(true)
                .build();

        var quotes = client.getRates(spec);

        server.verify();
        assertThat(quotes).hasSize(2);

        var ground = quotes.get(0);
        assertThat(ground.getCarrier()).isEqualTo(Carrier.UPS);
        assertThat(ground.getServiceName()).isEqualTo("UPS Ground");
        assertThat(ground.getTotalCharge()).isEqualByComparingTo("21.37");
        assertThat(ground.getTransitDays()).isNull();
        assertThat(ground.getEstimatedDeliveryDate()).isNull();

        var secondDay = quotes.get(1);
        assertThat(secondDay.getServiceName()).isEqualTo("02");
        assertThat(secondDay.getTotalCharge()).isEqualByComparingTo("48.10");
        assertThat(secondDay.getTransitDays()).isEqualTo(2);
        assertThat(secondDay.getEstimatedDeliveryDate()).isEqualTo("20240319");
    }

    @Test
    void omitsOptionalBlocksWhenAbsent() {
        when(tokens.acquireToken(any())).thenReturn(new AccessToken("t"));

        server.expect(requestTo(RATE_URL))
                .andExpect(jsonPath("$.RateRequest.Shipment.ShipTo.Address.ResidentialAddressIndicator").doesNotExist())
                .andExpect(jsonPath("$.RateRequest.Shipment.ShipTo.Address.StateProvinceCode").doesNotExist())
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].Dimensions").doesNotExist())
                .andExpect(jsonPath("$.RateRequest.Shipment.Package[0].PackageServiceOptions").doesNotExist())
                .andExpect(jsonPath("$.RateRequest.Shipment.DeliveryTimeInformation").doesNotExist())
                .andRespond(withSuccess("""
                        {"RateResponse":{"RatedShipment":
                          {"Service":{"Code":"03","Description":"UPS Ground"},
                           "TotalCharges":{"MonetaryValue":"19.99"}}}}
                        """, MediaType.APPLICATION_JSON));

        var quotes = client.getRates(minimalSpec());

        server.verify();
        assertThat(quotes).singleElement()
                .satisfies(q -> assertThat(q.getTotalCharge()).isEqualByComparingTo("19.99"));
    }

    @Test
    void fractionalTransitDaysAreLeftUnset() {
        when(tokens.acquireToken(any())).thenReturn(new AccessToken("t"));

        server.expect(requestTo(RATE_URL))
                .andRespond(withSuccess("""
                        {"RateResponse":{"RatedShipment":[
                          {"Service":{"Description":"UPS 3 Day Select"},
                           "TotalCharges":{"MonetaryValue":"30.00"},
                           "GuaranteedDelivery":{"BusinessDaysInTransit":"2.5"}},
                          {"Service":{"Description":"UPS 2nd Day Air"},
                           "TotalCharges":{"MonetaryValue":"40.00"},
                           "GuaranteedDelivery":{"BusinessDaysInTransit":"2.0"}}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        var quotes = client.getRates(minimalSpec());

        assertThat(quotes).extracting(Quote::getTransitDays).containsExactly(null, 2);
    }

    @Test
    void nonSuccessRateResponseBecomesRateRequestException() {
        when(tokens.acquireToken(any())).thenReturn(new AccessToken("t"));
        server.expect(requestTo(RATE_URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("{\"response\":{\"errors\":[]}}"));

        assertThatThrownBy(() -> client.getRates(minimalSpec()))
                .isInstanceOfSatisfying(RateRequestException.class, e -> {
                    assertThat(e.getCarrier()).isEqualTo(Carrier.UPS);
                    assertThat(e.getStatus()).isEqualTo(400);
                    assertThat(e.getMessage()).startsWith("UPS rate error 400");
                });
    }

    @Test
    void authFailurePropagatesWithoutRateCall() {
        when(tokens.acquireToken(any())).thenThrow(new AuthException(Carrier.UPS, "UPS credentials missing"));

        assertThatThrownBy(() -> client.getRates(minimalSpec()))
                .isInstanceOf(AuthException.class)
                .hasMessage("UPS credentials missing");
        server.verify();
    }

    @Test
    void incompleteShipmentFailsBeforeAuthentication() {
        var spec = ShipmentSpec.builder().originZip("10001").destZip("94105").build();

        assertThatThrownBy(() -> client.getRates(spec))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("weight_lb");
        verifyNoInteractions(tokens);
    }

    @Test
    void acquiresAFreshTokenForEveryCall() {
        when(tokens.acquireToken(any())).thenReturn(new AccessToken("a"), new AccessToken("b"));
        server.expect(requestTo(RATE_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer a"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(RATE_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer b"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(client.getRates(minimalSpec())).isEmpty();
        assertThat(client.getRates(minimalSpec())).isEmpty();

        server.verify();
        verify(tokens, times(2)).acquireToken(any());
    }

    private static ShipmentSpec minimalSpec() {
        return ShipmentSpec.builder()
                .originZip("10001")
                .destZip("94105")
                .weightLb(new BigDecimal("3"))
                .build();
    }
}

package shippingquotes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import shippingquotes.auth.OAuthTokenProvider;
import shippingquotes.auth.TokenProvider;
import shippingquotes.carrier.CarrierClient;
import shippingquotes.carrier.EndpointResolver;
import shippingquotes.carrier.FedexRateClient;
import shippingquotes.carrier.UpsRateClient;

@Configuration
@EnableConfigurationProperties(CarrierProperties.class)
public class CarrierClientConfig {

    /**
     * Backed by the JDK HTTP client so that interrupting a timed-out carrier task
     * aborts its in-flight request.
     */
    @Bean
    public RestTemplate carrierRestTemplate(RestTemplateBuilder builder, CarrierProperties props) {
        return builder
                .requestFactory(() -> carrierRequestFactory(props))
                .build();
    }

    static ClientHttpRequestFactory carrierRequestFactory(CarrierProperties props) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(client);
        factory.setReadTimeout(props.getReadTimeout());
        return factory;
    }

    /**
     * Runs carrier pipelines concurrently. Each request uses at most one thread per carrier.
     */
    @Bean
    public ThreadPoolTaskExecutor carrierExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("carrier-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public EndpointResolver endpointResolver(CarrierProperties props) {
        return new EndpointResolver(props.getDeploymentMode());
    }

    @Bean
    public TokenProvider upsTokenProvider(RestTemplate carrierRestTemplate, EndpointResolver endpoints) {
        return OAuthTokenProvider.ups(carrierRestTemplate, endpoints);
    }

    @Bean
    public TokenProvider fedexTokenProvider(RestTemplate carrierRestTemplate, EndpointResolver endpoints) {
        return OAuthTokenProvider.fedex(carrierRestTemplate, endpoints);
    }

    @Bean
    public CarrierClient upsRateClient(
            RestTemplate carrierRestTemplate,
            ObjectMapper om,
            @Qualifier("upsTokenProvider") TokenProvider tokens,
            EndpointResolver endpoints,
            CarrierProperties props) {
        return new UpsRateClient(carrierRestTemplate, om, tokens, props.getUps(), endpoints,
                props.getCustomerContext());
    }

    @Bean
    public CarrierClient fedexRateClient(
            RestTemplate carrierRestTemplate,
            ObjectMapper om,
            @Qualifier("fedexTokenProvider") TokenProvider tokens,
            EndpointResolver endpoints,
            CarrierProperties props) {
        return new FedexRateClient(carrierRestTemplate, om, tokens, props.getFedex(), endpoints);
    }
}

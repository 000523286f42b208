package shippingquotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShippingQuotesApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShippingQuotesApplication.class, args);
    }
}

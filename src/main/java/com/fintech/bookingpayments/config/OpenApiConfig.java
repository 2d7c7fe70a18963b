package com.fintech.bookingpayments.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI bookingPaymentsOpenAPI(PaymentProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Booking Payments Service API")
                        .description("Payment requests for bookings, processor webhooks, reconciliation of missed "
                                + "webhooks and cancellation. Environment: " + properties.getEnvironment())
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Payments Team")
                                .email("payments@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}

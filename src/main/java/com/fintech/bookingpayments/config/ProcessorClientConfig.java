package com.fintech.bookingpayments.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the processor's checkout API with bounded timeouts.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ProcessorClientConfig {

    private final PaymentProperties properties;

    @Bean
    public RestTemplate processorRestTemplate(RestTemplateBuilder builder) {
        PaymentProperties.Processor processor = properties.getProcessor();

        RestTemplate restTemplate = builder
                .rootUri(processor.getBaseUrl())
                .setConnectTimeout(processor.getConnectTimeout())
                .setReadTimeout(processor.getReadTimeout())
                .additionalInterceptors(authorizationInterceptor(processor.getApiKey()))
                .additionalInterceptors(loggingInterceptor())
                .build();

        log.info("Processor client configured for {} with connect timeout {} and read timeout {}",
                processor.getBaseUrl(), processor.getConnectTimeout(), processor.getReadTimeout());

        return restTemplate;
    }

    private ClientHttpRequestInterceptor authorizationInterceptor(String apiKey) {
        return (request, body, execution) -> {
            if (StringUtils.hasText(apiKey)) {
                request.getHeaders().set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
            }
            return execution.execute(request, body);
        };
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            var response = execution.execute(request, body);
            log.debug("Processor {} {} -> {} in {}ms", request.getMethod(), request.getURI(),
                    response.getStatusCode(), System.currentTimeMillis() - startTime);
            return response;
        };
    }
}

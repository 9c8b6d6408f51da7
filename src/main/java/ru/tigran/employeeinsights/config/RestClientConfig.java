package ru.tigran.employeeinsights.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP клиент для AI провайдера с таймаутами на подключение и чтение
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient aiRestClient(
            RestClient.Builder builder,
            @Value("${app.ai.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${app.ai.read-timeout-seconds:60}") long readTimeoutSeconds
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) Duration.ofSeconds(connectTimeoutSeconds).toMillis());
        factory.setReadTimeout((int) Duration.ofSeconds(readTimeoutSeconds).toMillis());
        return builder.requestFactory(factory).build();
    }
}

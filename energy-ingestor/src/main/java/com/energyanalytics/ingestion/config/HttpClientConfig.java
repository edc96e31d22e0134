package com.energyanalytics.ingestion.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * HTTP clients and the clock shared by the ingestion pipeline.
 *
 * RestTemplate serves the JSON APIs, the JDK HttpClient streams bulk downloads.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, EnergyIngestionProperties properties) {
        Duration timeout = properties.getWeather().getRequestTimeout();
        return builder
                .setConnectTimeout(Duration.ofSeconds(30))
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

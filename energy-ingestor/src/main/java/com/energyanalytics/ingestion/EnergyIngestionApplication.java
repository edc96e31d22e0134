package com.energyanalytics.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class EnergyIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyIngestionApplication.class, args);
    }
}

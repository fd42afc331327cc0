package com.company.energyanalytics;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@OpenAPIDefinition(
        info = @Info(
                title = "Energy Analytics Service API",
                version = "1.0.0",
                description = "Weekly interval-data analytics: sensor health, after-hours waste, anomalies, "
                        + "demand spikes and quick wins"
        )
)
public class EnergyAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyAnalyticsApplication.class, args);
    }
}

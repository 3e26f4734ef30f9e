package com.company.footprint;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "Footprint Service API",
                version = "1.0.0",
                description = "Cluster job usage, energy and carbon footprint accounting"
        )
)
public class FootprintServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FootprintServiceApplication.class, args);
    }
}

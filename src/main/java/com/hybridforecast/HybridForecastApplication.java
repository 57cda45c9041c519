package com.hybridforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HybridForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(HybridForecastApplication.class, args);
    }
}

package com.valuationradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ValuationRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValuationRadarApplication.class, args);
    }
}

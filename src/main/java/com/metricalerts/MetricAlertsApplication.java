package com.metricalerts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetricAlertsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricAlertsApplication.class, args);
    }
}

package com.finance.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinanceAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinanceAnomalyDetectionApplication.class, args);
    }
}

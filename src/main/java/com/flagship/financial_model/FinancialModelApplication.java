package com.flagship.financial_model;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinancialModelApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinancialModelApplication.class, args);
    }
}

package com.hfm.budget;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BudgetAnalysisServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BudgetAnalysisServiceApplication.class, args);
    }
}

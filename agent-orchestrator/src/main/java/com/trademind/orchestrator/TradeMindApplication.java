package com.trademind.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.trademind")
public class TradeMindApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeMindApplication.class, args);
    }
}

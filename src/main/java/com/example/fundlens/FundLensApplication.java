package com.example.fundlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FundLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundLensApplication.class, args);
    }
}

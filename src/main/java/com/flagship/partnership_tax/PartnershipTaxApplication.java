package com.flagship.partnership_tax;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PartnershipTaxApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartnershipTaxApplication.class, args);
    }
}

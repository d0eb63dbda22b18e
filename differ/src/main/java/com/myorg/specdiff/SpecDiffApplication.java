package com.myorg.specdiff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpecDiffApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpecDiffApplication.class, args);
    }
}

package com.boundplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BoundPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoundPlanApplication.class, args);
    }
}

package com.napkin.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NapkinApplication {

    public static void main(String[] args) {
        SpringApplication.run(NapkinApplication.class, args);
    }
}

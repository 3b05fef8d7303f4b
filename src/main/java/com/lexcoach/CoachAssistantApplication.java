package com.lexcoach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CoachAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoachAssistantApplication.class, args);
    }
}

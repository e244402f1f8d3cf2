package com.example.mafiaengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class MafiaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MafiaEngineApplication.class, args);
    }
}

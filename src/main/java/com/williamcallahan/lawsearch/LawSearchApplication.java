package com.williamcallahan.lawsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LawSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LawSearchApplication.class, args);
    }

}

package com.barthel.biasadjust;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BiasAdjustApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiasAdjustApplication.class, args);
    }
}

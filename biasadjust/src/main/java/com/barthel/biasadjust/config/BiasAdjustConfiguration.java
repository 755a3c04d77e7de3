package com.barthel.biasadjust.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BiasAdjustConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.moneytrail.insights.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(MoneytrailProperties properties) {
        return Clock.system(properties.zone());
    }
}

package com.moneytrail.insights;

import com.moneytrail.insights.config.MoneytrailProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MoneytrailProperties.class)
public class MoneytrailInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MoneytrailInsightsApplication.class, args);
    }
}

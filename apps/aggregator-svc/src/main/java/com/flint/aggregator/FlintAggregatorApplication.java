package com.flint.aggregator;

import com.flint.aggregator.config.FlintProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(FlintProperties.class)
@EnableScheduling
public class FlintAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlintAggregatorApplication.class, args);
    }
}

package com.litesql.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.litesql")
@ConfigurationPropertiesScan(basePackages = "com.litesql")
public class LiteSqlApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiteSqlApplication.class, args);
    }
}

package com.portfolio.projection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PortfolioProjectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioProjectionApplication.class, args);
    }
}

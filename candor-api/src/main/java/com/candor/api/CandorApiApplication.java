package com.candor.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Candor Platform API Application
 *
 * Confidential case reporting with sealed fields and oracle-verified disclosure.
 */
@SpringBootApplication(scanBasePackages = "com.candor")
public class CandorApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CandorApiApplication.class, args);
    }
}

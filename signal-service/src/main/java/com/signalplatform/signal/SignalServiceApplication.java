package com.signalplatform.signal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Signal service: refreshes all market sources on a fixed cadence, computes the weighted
 * verdict and serves the latest published state read-only over HTTP.
 * Source clients and their WebClients come from the market-data-service module.
 */
@SpringBootApplication(scanBasePackages = "com.signalplatform")
public class SignalServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalServiceApplication.class, args);
    }
}

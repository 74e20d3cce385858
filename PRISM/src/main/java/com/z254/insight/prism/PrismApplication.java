package com.z254.insight.prism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PRISM - issue analytics over tracker exports.
 * <p>
 * Normalizes raw issue records, extracts integration apps, customers and root causes,
 * classifies holiday periods, and builds per-month tables with trend and anomaly flags.
 */
@SpringBootApplication
public class PrismApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PrismApplication.class, args)));
    }
}

package org.healthcare.loader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Healthcare Mongo Loader.
 *
 * Reads the healthcare admissions CSV export in chunks, normalizes each row
 * and loads it into MongoDB with idempotent natural-key upserts.
 */
@SpringBootApplication
public class HealthcareLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(HealthcareLoaderApplication.class, args)
        ));
    }
}

package com.palmid.palm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Palm Recognition Service Application
 *
 * Registers palms against an identity and recognizes them again from hand landmark detections.
 * Runs one command per process, e.g. {@code register palm.jpg 555-1111}; the JSON result goes to
 * stdout and the exit code is 0 unless the command was malformed or failed unexpectedly.
 */
@SpringBootApplication
public class PalmRecognitionServiceApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PalmRecognitionServiceApplication.class, args)));
    }
}

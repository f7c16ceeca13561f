package com.corvus.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the file operations demo.
 * Exits once the demo runner has finished so pool threads don't keep the JVM alive.
 */
@SpringBootApplication(scanBasePackages = {
    "com.corvus.examples",
    "com.corvus.engine"
})
public class FileOperationsDemoApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FileOperationsDemoApplication.class, args)));
    }
}

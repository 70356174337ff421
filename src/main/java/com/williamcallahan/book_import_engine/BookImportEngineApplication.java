/**
 * Main application class for the book import engine
 *
 * Features:
 * - Runs bulk book imports and reading-history imports as background jobs
 * - Exposes a polling surface for job status, cancellation and book matching
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.book_import_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookImportEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookImportEngineApplication.class, args);
    }
}

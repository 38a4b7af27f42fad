package com.github.dimitryivaniuta.newsletter;

import com.github.dimitryivaniuta.newsletter.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point for the newsletter delivery service.
 */
@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class NewsletterDeliveryApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(NewsletterDeliveryApplication.class, args);
    }
}

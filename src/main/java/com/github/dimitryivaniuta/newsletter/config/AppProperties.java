package com.github.dimitryivaniuta.newsletter.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Delivery delivery = new Delivery();
    private final Email email = new Email();

    @Getter
    @Setter
    public static class Delivery {
        /**
         * Advisory lock scope taken while an issue is being published.
         */
        private String publishLockScope = "newsletter:publish";

        private final Worker worker = new Worker();
        private final Retry retry = new Retry();
    }

    @Getter
    @Setter
    public static class Worker {
        /**
         * Start the worker pool together with the application context.
         */
        private boolean enabled = true;

        /**
         * Number of concurrent delivery workers.
         */
        private int poolSize = 4;

        /**
         * Idle sleep after a poll found nothing to claim.
         */
        private Duration pollInterval = Duration.ofSeconds(10);

        /**
         * Sleep after an iteration failed unexpectedly (e.g. database unreachable).
         */
        private Duration errorBackoff = Duration.ofSeconds(1);

        /**
         * Delivery attempts per task before it is dropped.
         */
        private int maxRetries = 5;

        /**
         * How long shutdown waits for in-flight deliveries.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Retry {
        /**
         * Back-off after the first transient failure of a task (doubles per attempt).
         */
        private Duration baseBackoff = Duration.ofSeconds(30);

        /**
         * Back-off cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Email {
        private String senderEmail = "newsletter@localhost";
        private String senderName = "Newsletter";
    }
}

package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.PostgresTestSupport;
import com.github.dimitryivaniuta.newsletter.domain.IssueStatus;
import com.github.dimitryivaniuta.newsletter.repo.DeliveryFailureRepository;
import com.github.dimitryivaniuta.newsletter.service.dto.IssueProgress;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Worker pool draining the queue end to end.
 */
@ExtendWith(OutputCaptureExtension.class)
class DeliveryWorkerPoolTest extends PostgresTestSupport {

    private static final Duration POLL = Duration.ofMillis(50);

    @Autowired
    DeliveryWorkerPool pool;

    @Autowired
    NewsletterPublisher publisher;

    @Autowired
    IssueProgressService progressService;

    @Autowired
    DeliveryFailureRepository failureRepository;

    @Autowired
    MeterRegistry meterRegistry;

    @AfterEach
    void stopPool() {
        pool.shutdown();
    }

    @Test
    void workersDrainQueueAndCompleteIssue() throws Exception {
        confirmedSubscribers(25);
        UUID issueId = publisher.publish(draft()).issueId();

        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> {
            try {
                pool.runWorker(4, POLL, 3);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });

        IssueProgress progress = awaitCompletion(issueId, Duration.ofSeconds(30));
        Assertions.assertEquals(IssueStatus.COMPLETED, progress.status());
        Assertions.assertEquals(25, progress.finishedTasks());
        Assertions.assertEquals(0, progress.remainingTasks());
        Mockito.verify(emailClient, Mockito.times(25))
                .send(Mockito.any(), Mockito.anyString(), Mockito.anyString(), Mockito.anyString());

        Assertions.assertFalse(running.isDone(), "runWorker must block until shutdown");
        pool.shutdown();
        running.get(10, TimeUnit.SECONDS);
        Assertions.assertFalse(pool.isRunning());
    }

    @Test
    void workerSurvivesFailedIteration() throws Exception {
        confirmedSubscribers(3);
        UUID issueId = publisher.publish(draft()).issueId();
        Mockito.doThrow(new IllegalStateException("mail relay glitch"))
                .doNothing()
                .when(emailClient).send(Mockito.any(), Mockito.anyString(), Mockito.anyString(), Mockito.anyString());

        pool.start(1, POLL, 3);

        IssueProgress progress = awaitCompletion(issueId, Duration.ofSeconds(30));
        Assertions.assertEquals(IssueStatus.COMPLETED, progress.status());
        Assertions.assertEquals(3, progress.finishedTasks());
        Mockito.verify(emailClient, Mockito.times(4))
                .send(Mockito.any(), Mockito.anyString(), Mockito.anyString(), Mockito.anyString());
    }

    @Test
    void workerWaitsOutStorageOutage() throws Exception {
        confirmedSubscribers(2);
        UUID issueId = publisher.publish(draft()).issueId();
        double retriesBefore = meterRegistry.get("newsletter.delivery.retry").counter().count();
        Mockito.doThrow(new DataAccessResourceFailureException("connection to database lost"))
                .doNothing()
                .when(emailClient).send(Mockito.any(), Mockito.anyString(), Mockito.anyString(), Mockito.anyString());

        pool.start(1, POLL, 3);

        IssueProgress progress = awaitCompletion(issueId, Duration.ofSeconds(30));
        Assertions.assertEquals(IssueStatus.COMPLETED, progress.status());
        Assertions.assertEquals(progress.requiredTasks(), progress.finishedTasks());
        Assertions.assertTrue(pool.isRunning());
        Assertions.assertEquals(retriesBefore, meterRegistry.get("newsletter.delivery.retry").counter().count(),
                "a storage outage is not a delivery attempt");
        Assertions.assertTrue(failureRepository.findAllByIssueId(issueId).isEmpty());
        Mockito.verify(emailClient, Mockito.times(3))
                .send(Mockito.any(), Mockito.anyString(), Mockito.anyString(), Mockito.anyString());
    }

    @Test
    void dyingWorkerIsLogged(CapturedOutput output) throws Exception {
        confirmedSubscribers(1);
        UUID issueId = publisher.publish(draft()).issueId();
        Mockito.doThrow(new NoClassDefFoundError("jakarta/mail/Transport"))
                .when(emailClient).send(Mockito.any(), Mockito.anyString(), Mockito.anyString(), Mockito.anyString());

        pool.start(1, POLL, 3);

        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!output.getAll().contains("Delivery worker delivery-worker-1 died") && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        Assertions.assertTrue(output.getAll().contains("Delivery worker delivery-worker-1 died"));
        Assertions.assertEquals(1, progressService.issueProgress(issueId).remainingTasks());
    }

    @Test
    void runWorkerRefusesWhilePoolIsAlreadyRunning() {
        pool.start(1, POLL, 3);

        Assertions.assertThrows(IllegalStateException.class, () -> pool.runWorker(1, POLL, 3));
        Assertions.assertTrue(pool.isRunning());
    }

    @Test
    void poolCannotBeStartedTwice() {
        pool.start(1, POLL, 3);

        Assertions.assertTrue(pool.isRunning());
        Assertions.assertThrows(IllegalStateException.class, () -> pool.start(1, POLL, 3));
    }

    @Test
    void invalidPoolSettingsAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> pool.start(0, POLL, 3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> pool.start(1, POLL, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> pool.start(1, Duration.ofMillis(-1), 3));
        Assertions.assertFalse(pool.isRunning());
    }

    private IssueProgress awaitCompletion(UUID issueId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        IssueProgress progress = progressService.issueProgress(issueId);
        while (progress.status() != IssueStatus.COMPLETED && System.nanoTime() < deadline) {
            Thread.sleep(100);
            progress = progressService.issueProgress(issueId);
        }
        return progress;
    }
}

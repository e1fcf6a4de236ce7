package io.herald4j.internal.mongo;

import io.herald4j.ContentSource;
import io.herald4j.JobStateMachine;
import io.herald4j.Publisher;
import io.herald4j.core.FixedContent;
import io.herald4j.core.Job;
import io.herald4j.core.JobStatus;
import io.herald4j.core.PermanentPublishException;
import io.herald4j.core.PublishResult;
import io.herald4j.core.PublishedRecord;
import io.herald4j.core.RetryPolicy;
import io.herald4j.core.TransientPublishException;
import io.herald4j.core.TransitionFields;
import io.herald4j.core.Variant;
import io.herald4j.selection.VariantValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PublishWorkerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T11:00:05Z");
    private static final Instant PLANNED_AT = Instant.parse("2024-06-01T11:00:00Z");

    private MongoJobStore jobStore;
    private JobStateMachine stateMachine;
    private MongoPublishedRecordStore publishedStore;
    private ContentSource contentSource;
    private Publisher publisher;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        jobStore = mock(MongoJobStore.class);
        stateMachine = mock(JobStateMachine.class);
        publishedStore = mock(MongoPublishedRecordStore.class);
        contentSource = mock(ContentSource.class);
        publisher = mock(Publisher.class);
        executor = Executors.newSingleThreadExecutor();

        when(publishedStore.findByJobId(anyString())).thenReturn(Optional.empty());
        when(publishedStore.insert(any())).thenReturn(true);
        when(contentSource.findVariant("t-1", "v-1"))
                .thenReturn(Optional.of(new Variant("v-1", "t-1", "Good morning", 1, true)));
        when(stateMachine.transitionIfStatus(eq("job-1"), eq(JobStatus.FAILED), eq(JobStatus.DEAD_LETTER), any()))
                .thenReturn(Optional.of(job(JobStatus.DEAD_LETTER, 1, "v-1", null)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void enqueuedJobShouldPublishRecordAndSucceed() throws Exception {
        runnable(JobStatus.ENQUEUED, 1);
        when(publisher.publish("Good morning", List.of())).thenReturn(new PublishResult("ext-1"));

        PublishWorker.Outcome outcome = worker(Duration.ofSeconds(5)).process("job-1");

        assertEquals(PublishWorker.Outcome.SUCCEEDED, outcome);
        ArgumentCaptor<PublishedRecord> record = ArgumentCaptor.forClass(PublishedRecord.class);
        InOrder order = inOrder(publishedStore, stateMachine);
        order.verify(publishedStore).insert(record.capture());
        order.verify(stateMachine).transition("job-1", JobStatus.SUCCEEDED, TransitionFields.published("ext-1"));
        assertEquals("ext-1", record.getValue().externalId());
        assertEquals("t-1", record.getValue().templateId());
        assertEquals("v-1", record.getValue().variantId());
        assertEquals(NOW, record.getValue().publishedAt());
    }

    @Test
    void claimShouldCarryWorkerId() throws Exception {
        runnable(JobStatus.FAILED, 2);
        when(publisher.publish(anyString(), anyList())).thenReturn(new PublishResult("ext-2"));

        worker(Duration.ofSeconds(5)).process("job-1");

        verify(stateMachine).transitionIfStatus("job-1", JobStatus.FAILED, JobStatus.RUNNING,
                TransitionFields.worker("worker-1"));
    }

    @Test
    void transientFailureShouldScheduleRetryWithBackoff() throws Exception {
        runnable(JobStatus.ENQUEUED, 1);
        when(publisher.publish(anyString(), anyList())).thenThrow(new TransientPublishException("rate limited"));

        PublishWorker.Outcome outcome = worker(Duration.ofSeconds(5)).process("job-1");

        assertEquals(PublishWorker.Outcome.RETRY_SCHEDULED, outcome);
        verify(stateMachine).transition("job-1", JobStatus.FAILED,
                TransitionFields.retryAt("transient: rate limited", NOW.plusSeconds(10)));
        verify(publishedStore, never()).insert(any());
    }

    @Test
    void transientFailureOnLastAttemptShouldDeadLetter() throws Exception {
        runnable(JobStatus.FAILED, 5);
        when(publisher.publish(anyString(), anyList())).thenThrow(new TransientPublishException("503"));

        PublishWorker.Outcome outcome = worker(Duration.ofSeconds(5)).process("job-1");

        assertEquals(PublishWorker.Outcome.DEAD_LETTERED, outcome);
        ArgumentCaptor<TransitionFields> failed = ArgumentCaptor.forClass(TransitionFields.class);
        InOrder order = inOrder(stateMachine);
        order.verify(stateMachine).transition(eq("job-1"), eq(JobStatus.FAILED), failed.capture());
        order.verify(stateMachine).transitionIfStatus(eq("job-1"), eq(JobStatus.FAILED), eq(JobStatus.DEAD_LETTER), any());
        assertNull(failed.getValue().nextAttemptAt());
        assertThat(failed.getValue().error()).contains("attempts exhausted: 5");
    }

    @Test
    void deadLetterLostToAnotherWriterShouldSkip() throws Exception {
        runnable(JobStatus.ENQUEUED, 1);
        when(publisher.publish(anyString(), anyList())).thenThrow(new PermanentPublishException("gone"));
        when(stateMachine.transitionIfStatus(eq("job-1"), eq(JobStatus.FAILED), eq(JobStatus.DEAD_LETTER), any()))
                .thenReturn(Optional.empty());

        assertEquals(PublishWorker.Outcome.SKIPPED, worker(Duration.ofSeconds(5)).process("job-1"));
    }

    @Test
    void permanentFailureShouldDeadLetterImmediately() throws Exception {
        runnable(JobStatus.ENQUEUED, 1);
        when(publisher.publish(anyString(), anyList())).thenThrow(new PermanentPublishException("401 unauthorized"));

        PublishWorker.Outcome outcome = worker(Duration.ofSeconds(5)).process("job-1");

        assertEquals(PublishWorker.Outcome.DEAD_LETTERED, outcome);
        ArgumentCaptor<TransitionFields> fields = ArgumentCaptor.forClass(TransitionFields.class);
        verify(stateMachine).transitionIfStatus(eq("job-1"), eq(JobStatus.FAILED), eq(JobStatus.DEAD_LETTER),
                fields.capture());
        assertThat(fields.getValue().error()).startsWith("permanent: ").contains("401");
        verify(stateMachine).transition("job-1", JobStatus.FAILED, TransitionFields.error(fields.getValue().error()));
    }

    @Test
    void slowPublisherShouldTimeOutAsTransient() throws Exception {
        runnable(JobStatus.ENQUEUED, 1);
        when(publisher.publish(anyString(), anyList())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return new PublishResult("too-late");
        });

        PublishWorker.Outcome outcome = worker(Duration.ofMillis(100)).process("job-1");

        assertEquals(PublishWorker.Outcome.RETRY_SCHEDULED, outcome);
        ArgumentCaptor<TransitionFields> fields = ArgumentCaptor.forClass(TransitionFields.class);
        verify(stateMachine).transition(eq("job-1"), eq(JobStatus.FAILED), fields.capture());
        assertThat(fields.getValue().error()).contains("timed out");
    }

    @Test
    void existingPublishedRecordShouldCompleteWithoutPublishing() throws Exception {
        runnable(JobStatus.FAILED, 2);
        when(publishedStore.findByJobId("job-1"))
                .thenReturn(Optional.of(new PublishedRecord("job-1", "s-1", "ext-9", NOW, "t-1", "v-1")));

        PublishWorker.Outcome outcome = worker(Duration.ofSeconds(5)).process("job-1");

        assertEquals(PublishWorker.Outcome.SUCCEEDED, outcome);
        verify(publisher, never()).publish(anyString(), anyList());
        verify(stateMachine).transition("job-1", JobStatus.SUCCEEDED, TransitionFields.published("ext-9"));
    }

    @Test
    void deactivatedVariantShouldDeadLetter() throws Exception {
        runnable(JobStatus.ENQUEUED, 1);
        when(contentSource.findVariant("t-1", "v-1"))
                .thenReturn(Optional.of(new Variant("v-1", "t-1", "Good morning", 1, false)));

        PublishWorker.Outcome outcome = worker(Duration.ofSeconds(5)).process("job-1");

        assertEquals(PublishWorker.Outcome.DEAD_LETTERED, outcome);
        verify(publisher, never()).publish(anyString(), anyList());
    }

    @Test
    void deletedFixedContentShouldDeadLetter() throws Exception {
        Job job = job(JobStatus.ENQUEUED, 0, null, "c-1");
        when(jobStore.findById("job-1")).thenReturn(Optional.of(job));
        when(stateMachine.transitionIfStatus(eq("job-1"), eq(JobStatus.ENQUEUED), eq(JobStatus.RUNNING), any()))
                .thenReturn(Optional.of(job(JobStatus.RUNNING, 1, null, "c-1")));
        when(contentSource.fixedContent("c-1")).thenReturn(Optional.of(new FixedContent("c-1", "bye", List.of(), true)));

        PublishWorker.Outcome outcome = worker(Duration.ofSeconds(5)).process("job-1");

        assertEquals(PublishWorker.Outcome.DEAD_LETTERED, outcome);
        verify(publisher, never()).publish(anyString(), anyList());
    }

    @Test
    void fixedContentShouldPublishWithMedia() throws Exception {
        Job job = job(JobStatus.ENQUEUED, 0, null, "c-1");
        when(jobStore.findById("job-1")).thenReturn(Optional.of(job));
        when(stateMachine.transitionIfStatus(eq("job-1"), eq(JobStatus.ENQUEUED), eq(JobStatus.RUNNING), any()))
                .thenReturn(Optional.of(job(JobStatus.RUNNING, 1, null, "c-1")));
        when(contentSource.fixedContent("c-1"))
                .thenReturn(Optional.of(new FixedContent("c-1", "launch day", List.of("media-1"), false)));
        when(publisher.publish("launch day", List.of("media-1"))).thenReturn(new PublishResult("ext-3"));

        assertEquals(PublishWorker.Outcome.SUCCEEDED, worker(Duration.ofSeconds(5)).process("job-1"));
    }

    @Test
    void lostClaimShouldSkip() throws Exception {
        when(jobStore.findById("job-1")).thenReturn(Optional.of(job(JobStatus.ENQUEUED, 0, "v-1", null)));
        when(stateMachine.transitionIfStatus(any(), any(), any(), any())).thenReturn(Optional.empty());

        assertEquals(PublishWorker.Outcome.SKIPPED, worker(Duration.ofSeconds(5)).process("job-1"));
        verify(publisher, never()).publish(anyString(), anyList());
    }

    @Test
    void terminalJobShouldBeSkipped() {
        when(jobStore.findById("job-1")).thenReturn(Optional.of(job(JobStatus.SUCCEEDED, 1, "v-1", null)));

        assertEquals(PublishWorker.Outcome.SKIPPED, worker(Duration.ofSeconds(5)).process("job-1"));
        verify(stateMachine, never()).transitionIfStatus(any(), any(), any(), any());
    }

    private void runnable(JobStatus status, int attemptAfterClaim) {
        when(jobStore.findById("job-1")).thenReturn(Optional.of(job(status, attemptAfterClaim - 1, "v-1", null)));
        when(stateMachine.transitionIfStatus(eq("job-1"), eq(status), eq(JobStatus.RUNNING), any()))
                .thenReturn(Optional.of(job(JobStatus.RUNNING, attemptAfterClaim, "v-1", null)));
    }

    private PublishWorker worker(Duration timeout) {
        RetryPolicy retryPolicy = new RetryPolicy(5, Duration.ofSeconds(10), Duration.ofMinutes(10), 0.2, () -> 0.0);
        return new PublishWorker(jobStore, stateMachine, publishedStore, contentSource, new VariantValidator(),
                publisher, retryPolicy, timeout, executor, "worker-1", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Job job(JobStatus status, int attempt, String variantId, String contentId) {
        return new Job("job-1", "s-1", PLANNED_AT, variantId == null ? null : "t-1", contentId, variantId,
                null, null, status, attempt, attempt, PLANNED_AT, PLANNED_AT, PLANNED_AT, null, null, null,
                NOW, null, null, null);
    }
}

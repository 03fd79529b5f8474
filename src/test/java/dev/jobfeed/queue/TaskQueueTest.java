package dev.jobfeed.queue;

import dev.jobfeed.entity.TaskExecutionRecord;
import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskStatus;
import dev.jobfeed.model.TaskType;
import dev.jobfeed.repository.TaskExecutionRecordRepository;
import dev.jobfeed.source.SourceFormatException;
import dev.jobfeed.source.SourceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class TaskQueueTest {

    private static final Duration WAIT = Duration.ofSeconds(20);
    private static final Instant OCCURRENCE = Instant.parse("2024-06-01T02:00:00Z");

    @MockitoBean
    private TaskHandlerRegistry handlerRegistry;

    @Autowired
    private TaskQueue taskQueue;

    @Autowired
    private TaskLockService lockService;

    @Autowired
    private TaskExecutionRecordRepository executionRepository;

    private final ScriptedHandler handler = new ScriptedHandler();
    private String taskName;

    @BeforeEach
    void setUp() {
        taskName = "task-" + UUID.randomUUID();
        when(handlerRegistry.find(TaskType.FETCH_JOBS)).thenReturn(Optional.of(handler));
    }

    private TaskHandle enqueue(Instant occurrence) {
        return taskQueue.enqueue(taskName, TaskType.FETCH_JOBS,
                TaskParams.builder().keywords(List.of("java")).build(), occurrence);
    }

    private TaskExecutionRecord record(TaskHandle handle) {
        return executionRepository.findById(handle.getExecutionId()).orElseThrow();
    }

    private boolean lockIsFree() {
        return lockService.find(taskName).map(lock -> lock.getOwnerId() == null).orElse(true);
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should run the handler and record success")
        void shouldRecordSuccess() throws Exception {
            handler.behaviour = ctx -> "done " + ctx.getParams().keywords();

            TaskHandle handle = enqueue(OCCURRENCE);

            assertThat(handle.isAccepted()).isTrue();
            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.SUCCEEDED);
            TaskExecutionRecord record = record(handle);
            assertThat(record.getStatus()).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(record.getResultSummary()).isEqualTo("done [java]");
            assertThat(record.getStartedAt()).isNotNull();
            assertThat(record.getFinishedAt()).isNotNull();
            assertThat(record.getWorkerId()).isEqualTo(WorkerId.current());
            assertThat(lockIsFree()).isTrue();
        }

        @Test
        @DisplayName("Should retry transient failures and then succeed")
        void shouldRetryTransientFailures() throws Exception {
            handler.behaviour = ctx -> {
                if (ctx.getAttempt() < 3) {
                    throw new SourceUnavailableException("jsearch", "HTTP 503");
                }
                return "ok";
            };

            TaskHandle handle = enqueue(OCCURRENCE);

            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(record(handle).getRetryCount()).isEqualTo(2);
            assertThat(handler.calls.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should mark failed after three retries and fire again next occurrence")
        void shouldFailAfterRetriesAndReleaseLock() throws Exception {
            handler.behaviour = ctx -> {
                throw new SourceUnavailableException("jsearch", "connection refused");
            };

            TaskHandle handle = enqueue(OCCURRENCE);

            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.FAILED);
            TaskExecutionRecord record = record(handle);
            assertThat(record.getRetryCount()).isEqualTo(3);
            assertThat(record.getLastError()).contains("connection refused");
            assertThat(handler.calls.get()).isEqualTo(4);
            assertThat(lockIsFree()).isTrue();

            handler.behaviour = ctx -> "recovered";
            TaskHandle next = enqueue(OCCURRENCE.plus(Duration.ofDays(1)));
            assertThat(next.isAccepted()).isTrue();
            assertThat(next.await(WAIT)).isEqualTo(TaskStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("Should not retry a malformed payload")
        void shouldNotRetryFormatErrors() throws Exception {
            handler.behaviour = ctx -> {
                throw new SourceFormatException("careerjet", "unexpected type", "<html>");
            };

            TaskHandle handle = enqueue(OCCURRENCE);

            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.FAILED);
            assertThat(handler.calls.get()).isEqualTo(1);
            assertThat(record(handle).getRetryCount()).isZero();
        }

        @Test
        @DisplayName("Should fail when no handler is registered for the type")
        void shouldFailWithoutHandler() throws Exception {
            TaskHandle handle = taskQueue.enqueue(taskName, TaskType.DEACTIVATE_STALE,
                    TaskParams.builder().build(), OCCURRENCE);

            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.FAILED);
            assertThat(record(handle).getLastError()).contains("No handler");
            assertThat(lockIsFree()).isTrue();
        }
    }

    @Nested
    @DisplayName("Mutual exclusion")
    class MutualExclusionTests {

        @Test
        @DisplayName("Should reject an overlapping run of the same task without a record")
        void shouldRejectOverlappingRun() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            handler.behaviour = ctx -> {
                started.countDown();
                await(release);
                return "slow";
            };

            TaskHandle first = enqueue(OCCURRENCE);
            assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

            TaskHandle second = enqueue(OCCURRENCE.plus(Duration.ofHours(12)));

            assertThat(second.isAccepted()).isFalse();
            assertThat(second.getExecutionId()).isNull();
            assertThat(second.getRejectionReason()).contains("lock");
            assertThat(executionRepository.findByTaskNameOrderByEnqueuedAtDesc(taskName)).hasSize(1);

            release.countDown();
            assertThat(first.await(WAIT)).isEqualTo(TaskStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("Should enqueue an occurrence only once")
        void shouldRejectDuplicateOccurrence() throws Exception {
            handler.behaviour = ctx -> "ok";

            TaskHandle first = enqueue(OCCURRENCE);
            assertThat(first.await(WAIT)).isEqualTo(TaskStatus.SUCCEEDED);
            TaskHandle again = enqueue(OCCURRENCE);

            assertThat(again.isAccepted()).isFalse();
            assertThat(again.getRejectionReason()).contains("already enqueued");
            assertThat(again.cancel()).isFalse();
            assertThat(executionRepository.findByTaskNameOrderByEnqueuedAtDesc(taskName)).hasSize(1);
        }

        @Test
        @DisplayName("Should take over a lock left behind by a finished run before its lease ends")
        void shouldTakeOverLockOfFinishedRun() throws Exception {
            handler.behaviour = ctx -> "after restart";
            String deadToken = "token-" + UUID.randomUUID();
            assertThat(lockService.tryAcquire(taskName, deadToken)).isTrue();
            previousRun(TaskStatus.FAILED, deadToken);

            TaskHandle handle = enqueue(OCCURRENCE.plus(Duration.ofHours(1)));

            assertThat(handle.isAccepted()).isTrue();
            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(record(handle).getLockToken()).isNotEqualTo(deadToken);
            assertThat(lockIsFree()).isTrue();
        }

        @Test
        @DisplayName("Should keep rejecting while the lock holder is still in flight")
        void shouldNotTakeOverLockOfRunningExecution() {
            String liveToken = "token-" + UUID.randomUUID();
            assertThat(lockService.tryAcquire(taskName, liveToken)).isTrue();
            TaskExecutionRecord running = previousRun(TaskStatus.RUNNING, liveToken);
            try {
                TaskHandle handle = enqueue(OCCURRENCE.plus(Duration.ofHours(1)));

                assertThat(handle.isAccepted()).isFalse();
                assertThat(handle.getRejectionReason()).contains("lock");
                assertThat(lockService.find(taskName).orElseThrow().getOwnerId()).isEqualTo(liveToken);
            } finally {
                running.setStatus(TaskStatus.SUCCEEDED);
                executionRepository.save(running);
                lockService.release(taskName, liveToken);
            }
        }

        @Test
        @DisplayName("Should not take over a lock whose holder has no record yet")
        void shouldNotTakeOverLockWithoutRecord() {
            String enqueuingToken = "token-" + UUID.randomUUID();
            assertThat(lockService.tryAcquire(taskName, enqueuingToken)).isTrue();
            try {
                assertThat(enqueue(OCCURRENCE).isAccepted()).isFalse();
                assertThat(lockService.find(taskName).orElseThrow().getOwnerId()).isEqualTo(enqueuingToken);
            } finally {
                lockService.release(taskName, enqueuingToken);
            }
        }

        private TaskExecutionRecord previousRun(TaskStatus status, String lockToken) {
            return executionRepository.save(TaskExecutionRecord.builder()
                    .taskName(taskName)
                    .taskType(TaskType.FETCH_JOBS)
                    .paramsJson("{}")
                    .scheduledFor(OCCURRENCE)
                    .status(status)
                    .lockToken(lockToken)
                    .workerId("host-gone")
                    .build());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Should stop a running task at its next checkpoint")
        void shouldCancelAtCheckpoint() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            handler.behaviour = ctx -> {
                started.countDown();
                while (true) {
                    ctx.checkpoint();
                    sleep(20);
                }
            };

            TaskHandle handle = enqueue(OCCURRENCE);
            assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

            assertThat(handle.cancel()).isTrue();

            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.CANCELLED);
            assertThat(record(handle).isCancelRequested()).isTrue();
            assertThat(lockIsFree()).isTrue();
        }

        @Test
        @DisplayName("Should not retry once cancelled")
        void shouldNotRetryAfterCancel() throws Exception {
            CountDownLatch failedOnce = new CountDownLatch(1);
            CountDownLatch cancelled = new CountDownLatch(1);
            handler.behaviour = ctx -> {
                failedOnce.countDown();
                await(cancelled);
                throw new SourceUnavailableException("jsearch", "timeout");
            };

            TaskHandle handle = enqueue(OCCURRENCE);
            assertThat(failedOnce.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(handle.cancel()).isTrue();
            cancelled.countDown();

            assertThat(handle.await(WAIT)).isEqualTo(TaskStatus.CANCELLED);
            assertThat(handler.calls.get()).isEqualTo(1);
            assertThat(taskQueue.cancel(handle.getExecutionId())).isFalse();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    static class ScriptedHandler implements TaskHandler {
        volatile Function<TaskContext, String> behaviour = ctx -> "ok";
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public TaskType type() {
            return TaskType.FETCH_JOBS;
        }

        @Override
        public String handle(TaskContext context) {
            calls.incrementAndGet();
            return behaviour.apply(context);
        }
    }
}

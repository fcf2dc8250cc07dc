package tw.gc.stock.crawler.services.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import tw.gc.stock.crawler.entities.JobExecution;
import tw.gc.stock.crawler.repositories.JobExecutionRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("JobRunner")
class JobRunnerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Mock
    private JobExecutionRepository jobExecutionRepository;

    @BeforeEach
    void setUp() {
        when(jobExecutionRepository.save(any(JobExecution.class))).thenAnswer(inv -> inv.getArgument(0));
        when(jobExecutionRepository.findByJobNameAndBusinessDate(anyString(), any())).thenReturn(Optional.empty());
    }

    private static PipelineJob job(String name, Function<LocalDate, JobOutcome> body) {
        return new PipelineJob() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public JobOutcome run(LocalDate businessDate) {
                return body.apply(businessDate);
            }
        };
    }

    @Nested
    @DisplayName("Execution record")
    class ExecutionRecord {

        @Test
        @DisplayName("should record a successful run")
        void shouldRecordSuccess() {
            JobRunner runner = new JobRunner(
                    List.of(job("refresh-dividend", d -> new JobOutcome(10, 10, 0, false, "ok"))),
                    jobExecutionRepository);

            JobExecution execution = runner.run("refresh-dividend", DAY);

            assertThat(execution.getStatus()).isEqualTo(JobExecution.Status.SUCCEEDED);
            assertThat(execution.getRunCount()).isEqualTo(1);
            assertThat(execution.getFetched()).isEqualTo(10);
            assertThat(execution.getFinishedAt()).isNotNull();
            verify(jobExecutionRepository, times(2)).save(execution);
        }

        @Test
        @DisplayName("a rerun should reuse the row and bump its run count")
        void shouldReuseRowOnRerun() {
            JobExecution previous = JobExecution.builder()
                    .id(5L).jobName("closing").businessDate(DAY)
                    .status(JobExecution.Status.PARTIAL).runCount(1).failed(3)
                    .build();
            when(jobExecutionRepository.findByJobNameAndBusinessDate("closing", DAY)).thenReturn(Optional.of(previous));
            JobRunner runner = new JobRunner(
                    List.of(job("closing", d -> new JobOutcome(5, 5, 0, false, "ok"))), jobExecutionRepository);

            JobExecution execution = runner.run("closing", DAY);

            assertThat(execution.getId()).isEqualTo(5L);
            assertThat(execution.getRunCount()).isEqualTo(2);
            assertThat(execution.getFailed()).isZero();
            assertThat(execution.getStatus()).isEqualTo(JobExecution.Status.SUCCEEDED);
        }

        @Test
        @DisplayName("a throwing job should be recorded as failed, not rethrown")
        void shouldRecordFailure() {
            JobRunner runner = new JobRunner(List.of(job("closing", d -> {
                throw new IllegalStateException("database gone");
            })), jobExecutionRepository);

            JobExecution execution = runner.run("closing", DAY);

            assertThat(execution.getStatus()).isEqualTo(JobExecution.Status.FAILED);
            assertThat(execution.getMessage()).isEqualTo("IllegalStateException: database gone");
        }

        @Test
        @DisplayName("long messages should be truncated")
        void shouldTruncateMessage() {
            String longMessage = "x".repeat(5000);
            JobRunner runner = new JobRunner(
                    List.of(job("closing", d -> new JobOutcome(1, 0, 1, false, longMessage))), jobExecutionRepository);

            JobExecution execution = runner.run("closing", DAY);

            assertThat(execution.getMessage()).hasSize(4000);
            assertThat(execution.getStatus()).isEqualTo(JobExecution.Status.PARTIAL);
        }
    }

    @Nested
    @DisplayName("Guards")
    class Guards {

        @Test
        @DisplayName("should refuse an unknown job")
        void shouldRejectUnknownJob() {
            JobRunner runner = new JobRunner(List.of(), jobExecutionRepository);

            assertThatThrownBy(() -> runner.run("nope", DAY)).isInstanceOf(IllegalArgumentException.class);
            assertThat(runner.hasJob("nope")).isFalse();
        }

        @Test
        @DisplayName("should refuse duplicate job names")
        void shouldRejectDuplicateNames() {
            List<PipelineJob> jobs = List.of(
                    job("closing", d -> JobOutcome.skipped("a")), job("closing", d -> JobOutcome.skipped("b")));

            assertThatThrownBy(() -> new JobRunner(jobs, jobExecutionRepository))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("closing");
        }

        @Test
        @DisplayName("should refuse a second run of the same job and date while one is running")
        void shouldRefuseConcurrentRun() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            JobRunner runner = new JobRunner(List.of(job("closing", d -> {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new JobOutcome(1, 1, 0, false, "ok");
            })), jobExecutionRepository);

            CompletableFuture<JobExecution> first = CompletableFuture.supplyAsync(() -> runner.run("closing", DAY));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> runner.run("closing", DAY)).isInstanceOf(JobAlreadyRunningException.class);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(JobExecution.Status.SUCCEEDED);
            // the key is free again
            assertThat(runner.run("closing", DAY).getStatus()).isEqualTo(JobExecution.Status.SUCCEEDED);
        }
    }
}

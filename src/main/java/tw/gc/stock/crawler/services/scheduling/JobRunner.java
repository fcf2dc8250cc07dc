package tw.gc.stock.crawler.services.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.stock.crawler.entities.JobExecution;
import tw.gc.stock.crawler.repositories.JobExecutionRepository;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs pipeline jobs keyed by (job name, business date).
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>Every run is recorded in {@code job_execution}; a rerun of the same key
 *       updates that row and bumps {@code run_count}</li>
 *   <li>A key that is already running in this process is refused with
 *       {@link JobAlreadyRunningException}</li>
 *   <li>An exception thrown by the job marks the run FAILED and is not
 *       rethrown; the next trigger simply runs it again</li>
 * </ul>
 */
@Service
@Slf4j
public class JobRunner {

    private static final int MAX_MESSAGE_LENGTH = 4000;

    private final Map<String, PipelineJob> jobs = new LinkedHashMap<>();
    private final JobExecutionRepository jobExecutionRepository;
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public JobRunner(List<PipelineJob> pipelineJobs, JobExecutionRepository jobExecutionRepository) {
        this.jobExecutionRepository = jobExecutionRepository;
        for (PipelineJob job : pipelineJobs) {
            if (jobs.putIfAbsent(job.name(), job) != null) {
                throw new IllegalStateException("Duplicate pipeline job name: " + job.name());
            }
        }
        log.info("🗓️ {} pipeline jobs available: {}", jobs.size(), jobs.keySet());
    }

    public boolean hasJob(String name) {
        return jobs.containsKey(name);
    }

    public Set<String> jobNames() {
        return jobs.keySet();
    }

    /**
     * @throws IllegalArgumentException    when no job has this name
     * @throws JobAlreadyRunningException when the same job runs for the same date
     */
    public JobExecution run(String name, LocalDate businessDate) {
        PipelineJob job = jobs.get(name);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job: " + name);
        }
        String key = name + "@" + businessDate;
        if (!running.add(key)) {
            throw new JobAlreadyRunningException(name, businessDate);
        }

        try {
            JobExecution execution = start(name, businessDate);
            log.info("🚀 Job {} started for {} (run #{})", name, businessDate, execution.getRunCount());
            long startNanos = System.nanoTime();
            try {
                JobOutcome outcome = job.run(businessDate);
                finish(execution, outcome);
                log.info("✅ Job {} for {} finished {} in {} s: {} fetched, {} merged, {} failed",
                        name, businessDate, execution.getStatus(),
                        Duration.ofNanos(System.nanoTime() - startNanos).toSeconds(),
                        outcome.fetched(), outcome.merged(), outcome.failed());
            } catch (RuntimeException e) {
                log.error("❌ Job {} failed for {}", name, businessDate, e);
                fail(execution, e);
            }
            return execution;
        } finally {
            running.remove(key);
        }
    }

    @Transactional(readOnly = true)
    public List<JobExecution> recentExecutions(String name) {
        return jobExecutionRepository.findTop30ByJobNameOrderByBusinessDateDesc(name);
    }

    // ========== Execution Record ==========

    private JobExecution start(String name, LocalDate businessDate) {
        JobExecution execution = jobExecutionRepository.findByJobNameAndBusinessDate(name, businessDate)
                .orElseGet(() -> JobExecution.builder().jobName(name).businessDate(businessDate).build());
        execution.setStatus(JobExecution.Status.RUNNING);
        execution.setRunCount(execution.getRunCount() + 1);
        execution.setFetched(0);
        execution.setMerged(0);
        execution.setFailed(0);
        execution.setMessage(null);
        execution.setStartedAt(LocalDateTime.now());
        execution.setFinishedAt(null);
        return jobExecutionRepository.save(execution);
    }

    private void finish(JobExecution execution, JobOutcome outcome) {
        execution.setStatus(outcome.status());
        execution.setFetched(outcome.fetched());
        execution.setMerged(outcome.merged());
        execution.setFailed(outcome.failed());
        execution.setMessage(truncate(outcome.message()));
        execution.setFinishedAt(LocalDateTime.now());
        jobExecutionRepository.save(execution);
    }

    private void fail(JobExecution execution, RuntimeException e) {
        execution.setStatus(JobExecution.Status.FAILED);
        execution.setMessage(truncate(e.getClass().getSimpleName() + ": " + e.getMessage()));
        execution.setFinishedAt(LocalDateTime.now());
        jobExecutionRepository.save(execution);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }
}

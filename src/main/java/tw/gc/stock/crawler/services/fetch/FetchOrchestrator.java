package tw.gc.stock.crawler.services.fetch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;
import tw.gc.stock.crawler.config.CrawlerProperties;
import tw.gc.stock.crawler.sources.FetchException;
import tw.gc.stock.crawler.sources.FetchTarget;
import tw.gc.stock.crawler.sources.SourceAdapter;
import tw.gc.stock.crawler.sources.SourceRegistry;
import tw.gc.stock.crawler.sources.records.NormalizedRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a {@link FetchJob} out over a bounded worker pool.
 *
 * <h3>Failure handling:</h3>
 * <ul>
 *   <li>Each item is retried up to {@code crawler.fetch.max-attempts} times with
 *       exponential backoff ({@code initial-backoff}, x2 per attempt)</li>
 *   <li>Each attempt is cut off after {@code crawler.fetch.attempt-timeout}</li>
 *   <li>An item that runs out of attempts is reported as a {@link FailedItem};
 *       the rest of the batch carries on</li>
 * </ul>
 *
 * Nothing is written to the store here; merging is the caller's business.
 */
@Service
@Slf4j
public class FetchOrchestrator implements DisposableBean {

    private final SourceRegistry sourceRegistry;
    private final CrawlerProperties.Fetch settings;

    // Runs single attempts so that a hung adapter call can be abandoned.
    // Sized like a batch pool, so at most pool-size adapter calls are in flight.
    private final ExecutorService attemptExecutor;

    public FetchOrchestrator(SourceRegistry sourceRegistry, CrawlerProperties properties) {
        this.sourceRegistry = sourceRegistry;
        this.settings = properties.getFetch();
        AtomicInteger counter = new AtomicInteger();
        this.attemptExecutor = Executors.newFixedThreadPool(Math.max(1, settings.getPoolSize()), r -> {
            Thread thread = new Thread(r, "fetch-attempt-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public FetchReport execute(FetchJob job) {
        long startNanos = System.nanoTime();
        List<FetchTarget> targets = job.targets();

        Optional<SourceAdapter> adapter = sourceRegistry.find(job.sourceName());
        if (adapter.isEmpty()) {
            log.error("❌ Unknown source '{}', {} targets not fetched", job.sourceName(), targets.size());
            List<FailedItem> failures = targets.stream()
                    .map(target -> new FailedItem(target, 0, "unknown source " + job.sourceName()))
                    .toList();
            return new FetchReport(job.sourceName(), List.of(), failures, 0, elapsedSince(startNanos));
        }
        if (targets.isEmpty()) {
            return new FetchReport(job.sourceName(), List.of(), List.of(), 0, elapsedSince(startNanos));
        }

        int poolSize = Math.max(1, Math.min(settings.getPoolSize(), targets.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<ItemOutcome> completion = new ExecutorCompletionService<>(pool);

        List<ItemOutcome> outcomes = new ArrayList<>(targets.size());
        Map<Future<ItemOutcome>, Integer> submitted = new IdentityHashMap<>();
        try {
            for (int i = 0; i < targets.size(); i++) {
                int index = i;
                FetchTarget target = targets.get(i);
                submitted.put(completion.submit(() -> fetchWithRetry(index, adapter.get(), target, job)), index);
            }
            for (int i = 0; i < targets.size(); i++) {
                Future<ItemOutcome> future = completion.take();
                try {
                    outcomes.add(future.get());
                } catch (ExecutionException e) {
                    // Only an Error gets here
                    int index = submitted.get(future);
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("❌ Fetch worker crashed on {} for source {}", targets.get(index), job.sourceName(), cause);
                    outcomes.add(new ItemOutcome(index, List.of(), new FailedItem(targets.get(index), 0,
                            "crashed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage())));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fetch batch for {} interrupted after {} of {} items",
                    job.sourceName(), outcomes.size(), targets.size());
        } finally {
            pool.shutdownNow();
        }

        // Completion order is nondeterministic, report in target order
        outcomes.sort(Comparator.comparingInt(ItemOutcome::index));

        List<NormalizedRecord> records = new ArrayList<>();
        List<FailedItem> failures = new ArrayList<>();
        int succeeded = 0;
        for (ItemOutcome outcome : outcomes) {
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                records.addAll(outcome.records());
                succeeded++;
            }
        }

        Duration elapsed = elapsedSince(startNanos);
        log.info("📥 Fetched {} from {}: {} items ok, {} failed, {} records in {} ms",
                targets.size(), job.sourceName(), succeeded, failures.size(), records.size(), elapsed.toMillis());
        return new FetchReport(job.sourceName(), records, failures, succeeded, elapsed);
    }

    private ItemOutcome fetchWithRetry(int index, SourceAdapter adapter, FetchTarget target, FetchJob job) {
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        String lastError = "no attempt made";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            List<NormalizedRecord> records = null;
            try {
                records = attempt(adapter, target);
            } catch (FetchException e) {
                lastError = e.getMessage();
                log.warn("Attempt {}/{} failed for {}: {}", attempt, maxAttempts, target, lastError);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new ItemOutcome(index, List.of(), new FailedItem(target, attempt, "interrupted"));
            }

            if (records != null) {
                return handle(index, target, records, job, attempt);
            }

            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(backoff(attempt).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return new ItemOutcome(index, List.of(), new FailedItem(target, attempt, "interrupted"));
                }
            }
        }

        log.warn("⚠️ Giving up on {} after {} attempts: {}", target, maxAttempts, lastError);
        return new ItemOutcome(index, List.of(), new FailedItem(target, maxAttempts, lastError));
    }

    private ItemOutcome handle(int index, FetchTarget target, List<NormalizedRecord> records,
                               FetchJob job, int attempts) {
        try {
            List<NormalizedRecord> handled = job.handler().handle(target, records);
            return new ItemOutcome(index, handled == null ? List.of() : handled, null);
        } catch (RuntimeException e) {
            // Handler failures are not retried
            log.error("❌ Record handler failed for {}", target, e);
            return new ItemOutcome(index, List.of(), new FailedItem(target, attempts, "handler: " + e.getMessage()));
        }
    }

    private List<NormalizedRecord> attempt(SourceAdapter adapter, FetchTarget target)
            throws FetchException, InterruptedException {
        Future<List<NormalizedRecord>> future = attemptExecutor.submit(() -> adapter.fetch(target));
        try {
            List<NormalizedRecord> records = future.get(settings.getAttemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return records == null ? List.of() : records;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchException(target, "timed out after " + settings.getAttemptTimeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof FetchException fetchException) {
                throw fetchException;
            }
            throw new FetchException(target, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    Duration backoff(int attempt) {
        return settings.getInitialBackoff().multipliedBy(1L << (attempt - 1));
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public void destroy() {
        attemptExecutor.shutdownNow();
    }

    private record ItemOutcome(int index, List<NormalizedRecord> records, FailedItem failure) {}
}

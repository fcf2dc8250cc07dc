package tw.gc.stock.crawler.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import tw.gc.stock.crawler.AppConstants;
import tw.gc.stock.crawler.entities.JobExecution;
import tw.gc.stock.crawler.services.scheduling.JobAlreadyRunningException;
import tw.gc.stock.crawler.services.scheduling.JobRunner;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Manual triggers for the scheduled pipeline jobs.
 * Runs synchronously; the response is the recorded execution.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobRunner jobRunner;

    @GetMapping
    public Set<String> jobs() {
        return jobRunner.jobNames();
    }

    /**
     * @param date business date, today in Taipei when omitted
     */
    @PostMapping("/{name}/run")
    public JobExecution run(@PathVariable String name,
                            @RequestParam(required = false)
                            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        requireJob(name);
        LocalDate businessDate = date != null ? date : LocalDate.now(AppConstants.TAIPEI_ZONE);
        log.info("🖐️ Manual run of {} for {}", name, businessDate);
        try {
            return jobRunner.run(name, businessDate);
        } catch (JobAlreadyRunningException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }

    @GetMapping("/{name}/executions")
    public List<JobExecution> executions(@PathVariable String name) {
        requireJob(name);
        return jobRunner.recentExecutions(name);
    }

    private void requireJob(String name) {
        if (!jobRunner.hasJob(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + name);
        }
    }
}

package tw.gc.stock.crawler.services.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Registers one cron trigger per timetable entry. Each trigger runs its job
 * for the current date in the timetable's zone.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler implements SchedulingConfigurer {

    private final ScheduleTimetable timetable;
    private final JobRunner jobRunner;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        for (ScheduleTimetable.Entry entry : timetable.entries()) {
            if (!jobRunner.hasJob(entry.jobName())) {
                throw new IllegalStateException("Timetable names unknown job: " + entry.jobName());
            }
        }
        if (!timetable.enabled()) {
            log.warn("⚠️ Pipeline schedule disabled, jobs only run on manual trigger");
            return;
        }

        for (ScheduleTimetable.Entry entry : timetable.entries()) {
            registrar.addCronTask(new CronTask(() -> trigger(entry.jobName()),
                    new CronTrigger(entry.cron(), timetable.zone())));
            log.info("⏰ Scheduled {} at '{}' ({})", entry.jobName(), entry.cron(), timetable.zone());
        }
    }

    void trigger(String jobName) {
        LocalDate businessDate = LocalDate.now(timetable.zone());
        try {
            jobRunner.run(jobName, businessDate);
        } catch (JobAlreadyRunningException e) {
            log.warn("⚠️ {}", e.getMessage());
        } catch (RuntimeException e) {
            // Recording the run failed, the store is probably unreachable
            log.error("❌ Could not run {} for {}", jobName, businessDate, e);
        }
    }
}

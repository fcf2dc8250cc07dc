package tw.gc.stock.crawler.services.scheduling;

import org.springframework.scheduling.support.CronExpression;
import tw.gc.stock.crawler.config.CrawlerProperties;

import java.time.ZoneId;
import java.util.List;

/**
 * The daily timetable, fixed at startup.
 *
 * @param enabled false disables every cron trigger; manual runs still work
 * @param zone    zone the cron expressions are evaluated in
 * @param entries job name and six-field Spring cron expression, in timetable order
 */
public record ScheduleTimetable(boolean enabled, ZoneId zone, List<Entry> entries) {

    public record Entry(String jobName, String cron) {}

    public ScheduleTimetable {
        entries = List.copyOf(entries);
        for (Entry entry : entries) {
            if (entry.jobName() == null || entry.jobName().isBlank()) {
                throw new IllegalArgumentException("Timetable entry without job name");
            }
            if (!CronExpression.isValidExpression(entry.cron())) {
                throw new IllegalArgumentException(
                        "Invalid cron '" + entry.cron() + "' for job " + entry.jobName());
            }
        }
    }

    public static ScheduleTimetable from(CrawlerProperties.Schedule schedule) {
        List<Entry> entries = schedule.getJobs().stream()
                .map(job -> new Entry(job.getName(), job.getCron()))
                .toList();
        return new ScheduleTimetable(schedule.isEnabled(), ZoneId.of(schedule.getZone()), entries);
    }
}

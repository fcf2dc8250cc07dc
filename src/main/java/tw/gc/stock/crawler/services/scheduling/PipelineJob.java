package tw.gc.stock.crawler.services.scheduling;

import java.time.LocalDate;

/**
 * A named unit of the daily timetable. Running it twice for the same business
 * date must converge to the same store state.
 */
public interface PipelineJob {

    String name();

    JobOutcome run(LocalDate businessDate);
}

package tw.gc.stock.crawler.services.scheduling;

import java.time.LocalDate;

public class JobAlreadyRunningException extends IllegalStateException {

    public JobAlreadyRunningException(String jobName, LocalDate businessDate) {
        super("Job " + jobName + " is already running for " + businessDate);
    }
}

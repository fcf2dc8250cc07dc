package tw.gc.stock.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@SpringBootApplication
@EnableScheduling
public class StockCrawlerApplication {

    static {
        // Business dates and cron triggers are all Taipei local time
        TimeZone.setDefault(TimeZone.getTimeZone(AppConstants.TAIPEI_ZONE_ID));
    }

    public static void main(String[] args) {
        SpringApplication.run(StockCrawlerApplication.class, args);
    }
}

package tw.gc.stock.crawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.stock.crawler.sources.records.RecordKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private Fetch fetch = new Fetch();
    private Estimate estimate = new Estimate();
    private Portfolio portfolio = new Portfolio();
    private Schedule schedule = new Schedule();
    private Bridge bridge = new Bridge();

    @Data
    public static class Fetch {
        /**
         * Worker pool size for one fetch batch. Keeps the fan-out under the
         * external sources' rate limits.
         */
        private int poolSize = 8;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration attemptTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Estimate {
        /**
         * Calendar years of history used by the valuation estimators.
         */
        private int lookbackYears = 5;
        private double defaultPayoutRatio = 70.0;
    }

    @Data
    public static class Portfolio {
        /**
         * Sold lots keep appearing in snapshots for this many days.
         */
        private int recentlyClosedDays = 7;
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private String zone = "Asia/Taipei";
        private List<Entry> jobs = new ArrayList<>();

        @Data
        public static class Entry {
            private String name;
            private String cron;
        }
    }

    @Data
    public static class Bridge {
        private int timeoutMs = 10000;
        private Map<String, Source> sources = new LinkedHashMap<>();

        @Data
        public static class Source {
            /**
             * Path on the bridge; {key} is replaced by the fetch target key.
             */
            private String path;
            private RecordKind kind;
        }
    }
}

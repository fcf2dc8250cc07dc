package tw.gc.stock.crawler;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import tw.gc.stock.crawler.services.scheduling.JobRunner;
import tw.gc.stock.crawler.sources.SourceRegistry;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class StockCrawlerApplicationTest {

    @Autowired
    private JobRunner jobRunner;

    @Autowired
    private SourceRegistry sourceRegistry;

    @Test
    void contextLoadsWithEveryScheduledJob() {
        assertThat(jobRunner.jobNames()).contains(
                "closing",
                "refresh-emerging-net-asset-value",
                "refresh-payout-ratio",
                "refresh-quarterly-financials",
                "refresh-annual-financials",
                "refresh-revenue",
                "refresh-security-list",
                "refresh-stock-weight",
                "refresh-dividend",
                "refresh-foreign-holdings");
    }

    @Test
    void everyConfiguredSourceIsRegistered() {
        assertThat(sourceRegistry.names()).contains(
                "listed-quotes", "otc-quotes", "stock-index", "dividend", "revenue", "security-list");
    }
}

package tw.gc.stock.crawler;

import java.time.ZoneId;

/**
 * Application-wide constants
 */
public final class AppConstants {

    // Timezone configuration
    public static final ZoneId TAIPEI_ZONE = ZoneId.of("Asia/Taipei");
    public static final String TAIPEI_ZONE_ID = "Asia/Taipei";

    // Market identifiers used by stock.stock_exchange_market_id
    public static final int MARKET_LISTED = 2;
    public static final int MARKET_OVER_THE_COUNTER = 4;
    public static final int MARKET_EMERGING = 5;

    private AppConstants() {
        // Utility class
    }
}

package tw.gc.stock.crawler.services.fetch;

import tw.gc.stock.crawler.sources.FetchTarget;

public record FailedItem(FetchTarget target, int attempts, String reason) {}

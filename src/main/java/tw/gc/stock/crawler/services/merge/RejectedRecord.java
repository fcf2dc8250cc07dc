package tw.gc.stock.crawler.services.merge;

public record RejectedRecord(String key, String reason) {}

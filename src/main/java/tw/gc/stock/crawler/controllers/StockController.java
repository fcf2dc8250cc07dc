package tw.gc.stock.crawler.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import tw.gc.stock.crawler.entities.Estimate;
import tw.gc.stock.crawler.services.StockService;
import tw.gc.stock.crawler.services.StockService.SecurityInfoUpdate;
import tw.gc.stock.crawler.services.merge.ConflictException;
import tw.gc.stock.crawler.services.merge.RecordValidationException;
import tw.gc.stock.crawler.services.metrics.EstimateService;
import tw.gc.stock.crawler.services.metrics.YieldRankService;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Request/reply surface over the canonical store.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 *   <li>PUT /api/stocks/{code} - update security info through the merger</li>
 *   <li>GET /api/stocks/quotes?codes= - latest quote per known code</li>
 *   <li>GET /api/stocks/holidays/{year} - market holidays of a year</li>
 *   <li>GET /api/stocks/yield-rank - dividend yield ranking of a date</li>
 *   <li>GET /api/stocks/{code}/estimate - latest valuation band</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
@Slf4j
public class StockController {

    private final StockService stockService;
    private final YieldRankService yieldRankService;
    private final EstimateService estimateService;

    public record SecurityInfoRequest(
            String name,
            Integer marketId,
            Integer industryId,
            Double bookValuePerShare,
            Boolean suspended
    ) {}

    @PutMapping("/{code}")
    public Map<String, String> updateSecurityInfo(@PathVariable String code,
                                                  @RequestBody SecurityInfoRequest request) {
        log.info("📝 Updating security info for {}", code);
        try {
            String message = stockService.updateSecurityInfo(new SecurityInfoUpdate(code, request.name(),
                    request.marketId(), request.industryId(), request.bookValuePerShare(), request.suspended()));
            return Map.of("message", message);
        } catch (RecordValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (ConflictException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }

    @GetMapping("/quotes")
    public List<StockService.CurrentQuote> fetchCurrentQuotes(@RequestParam List<String> codes) {
        return stockService.fetchCurrentQuotes(codes);
    }

    @GetMapping("/holidays/{year}")
    public List<StockService.Holiday> fetchHolidaySchedule(@PathVariable int year) {
        return stockService.fetchHolidaySchedule(year);
    }

    @GetMapping("/yield-rank")
    public List<YieldRankService.RankedYield> yieldRank(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");
        }
        return yieldRankService.ranking(date, limit);
    }

    @GetMapping("/{code}/estimate")
    public ResponseEntity<Estimate> latestEstimate(@PathVariable String code) {
        return estimateService.getLatest(code)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}

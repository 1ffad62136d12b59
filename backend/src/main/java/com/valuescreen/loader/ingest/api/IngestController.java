package com.valuescreen.loader.ingest.api;

import com.valuescreen.loader.ingest.model.IngestRequest;
import com.valuescreen.loader.ingest.model.IngestResult;
import com.valuescreen.loader.ingest.model.IngestStatusResponse;
import com.valuescreen.loader.ingest.model.IngestTable;
import com.valuescreen.loader.ingest.service.MarketDataIngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin/ingest")
public class IngestController {
    private final MarketDataIngestionService ingestionService;

    public IngestController(MarketDataIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @GetMapping("/status")
    public IngestStatusResponse status() {
        return ingestionService.status();
    }

    @PostMapping("/tickers")
    public ResponseEntity<IngestResult> ingestTickers(
        @RequestParam(name = "ticker", required = false) String ticker,
        @RequestParam(name = "sp500", required = false) Boolean sp500
    ) {
        return respond(ingestionService.ingestTickers(new IngestRequest(split(ticker), null, null, sp500)));
    }

    @PostMapping("/fundamentals")
    public ResponseEntity<IngestResult> ingestFundamentals(
        @RequestParam(name = "ticker", required = false) String ticker,
        @RequestParam(name = "dimension", required = false) String dimension,
        @RequestParam(name = "full", required = false) Boolean full
    ) {
        return respond(ingestionService.ingestFundamentals(new IngestRequest(split(ticker), full, split(dimension), null)));
    }

    @PostMapping("/daily")
    public ResponseEntity<IngestResult> ingestDailyPrices(
        @RequestParam(name = "ticker", required = false) String ticker,
        @RequestParam(name = "full", required = false) Boolean full
    ) {
        return respond(ingestionService.ingestDailyPrices(new IngestRequest(split(ticker), full, null, null)));
    }

    @PostMapping("/benchmarks")
    public ResponseEntity<IngestResult> ingestBenchmarks(
        @RequestParam(name = "full", required = false) Boolean full
    ) {
        return respond(ingestionService.ingestBenchmarks(new IngestRequest(null, full, null, null)));
    }

    @PostMapping("/index-membership")
    public ResponseEntity<IngestResult> ingestIndexMembership(
        @RequestParam(name = "ticker", required = false) String ticker,
        @RequestParam(name = "full", required = false) Boolean full
    ) {
        return respond(ingestionService.ingestIndexMembership(new IngestRequest(split(ticker), full, null, null)));
    }

    @PostMapping("/{table}/cancel")
    public Map<String, Object> cancel(@PathVariable("table") String table) {
        IngestTable resolved;
        try {
            resolved = IngestTable.fromKey(table);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return Map.of("table", resolved.key(), "cancelled", ingestionService.cancel(resolved));
    }

    private static ResponseEntity<IngestResult> respond(IngestResult result) {
        HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(result);
    }

    private static List<String> split(String csv) {
        if (csv == null || csv.isBlank()) {
            return null;
        }
        return List.of(csv.split(","));
    }
}

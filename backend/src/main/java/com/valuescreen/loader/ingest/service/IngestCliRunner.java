package com.valuescreen.loader.ingest.service;

import com.valuescreen.loader.config.LoaderProperties;
import com.valuescreen.loader.ingest.model.IngestRequest;
import com.valuescreen.loader.ingest.model.IngestResult;
import com.valuescreen.loader.ingest.model.IngestTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class IngestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestCliRunner.class);

    private final LoaderProperties properties;
    private final MarketDataIngestionService ingestionService;
    private final ConfigurableApplicationContext applicationContext;

    public IngestCliRunner(
        LoaderProperties properties,
        MarketDataIngestionService ingestionService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.ingestionService = ingestionService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> tickers = Arrays.stream(properties.getCli().getTickers().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        IngestRequest request = new IngestRequest(tickers, properties.getCli().isFull(), null, null);

        boolean allSucceeded = true;
        for (IngestTable table : resolveTables(properties.getCli().getTables())) {
            IngestResult result;
            try {
                result = ingestionService.ingest(table, request);
            } catch (IngestPreconditionException | ActiveIngestionException e) {
                log.warn("Skipping {}: {}", table.key(), e.getMessage());
                allSucceeded = false;
                continue;
            }
            allSucceeded &= result.success();
            log.info("Ingest {}: success={}, count={}, elapsed={}, message={}",
                table.key(), result.success(), result.count(), result.elapsed(), result.message());
        }

        if (properties.getCli().isExitAfterRun()) {
            int status = allSucceeded ? 0 : 1;
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }

    /**
     * Configured tables in dependency order, so companies exist before anything keyed on them.
     */
    static List<IngestTable> resolveTables(String csv) {
        Set<IngestTable> selected = EnumSet.noneOf(IngestTable.class);
        if (csv != null) {
            for (String part : csv.split(",")) {
                if (!part.isBlank()) {
                    selected.add(IngestTable.fromKey(part));
                }
            }
        }
        return List.copyOf(selected);
    }
}

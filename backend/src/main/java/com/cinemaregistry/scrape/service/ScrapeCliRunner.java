package com.cinemaregistry.scrape.service;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.model.RunConfig;
import com.cinemaregistry.scrape.model.ScrapeRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeSupervisor supervisor;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeSupervisor supervisor,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.supervisor = supervisor;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ScraperProperties.Cli cli = properties.getCli();
        RunConfig config = new RunConfig(cli.getStartId(), cli.getEndId(), cli.getWorkerCount());
        log.info("Starting cinema scraper with config: {}", config);

        ScrapeRunSummary summary = supervisor.run(config);
        log.info(
            "Scrape run {} over {}-{}: processed={}, found={}, notFound={}, failed={}, skipped={}",
            summary.status(),
            config.start(),
            config.end(),
            summary.processed(),
            summary.found(),
            summary.notFound(),
            summary.failed(),
            summary.drained()
        );
        for (Map.Entry<String, Integer> reason : summary.failuresByReason().entrySet()) {
            log.info("Failures {}: {}", reason.getKey(), reason.getValue());
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}

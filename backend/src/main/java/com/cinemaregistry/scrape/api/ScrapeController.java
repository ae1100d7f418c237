package com.cinemaregistry.scrape.api;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.model.RunConfig;
import com.cinemaregistry.scrape.model.ScrapeRunStatusResponse;
import com.cinemaregistry.scrape.service.ScrapeSupervisor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scrape")
public class ScrapeController {
    private final ScrapeSupervisor supervisor;
    private final ScraperProperties properties;

    public ScrapeController(ScrapeSupervisor supervisor, ScraperProperties properties) {
        this.supervisor = supervisor;
        this.properties = properties;
    }

    @PostMapping("/run")
    public ResponseEntity<ScrapeRunStatusResponse> run(@RequestBody(required = false) ScrapeApiRunRequest request) {
        ScraperProperties.Cli defaults = properties.getCli();
        RunConfig config = new RunConfig(
            request == null || request.startId() == null ? defaults.getStartId() : request.startId(),
            request == null || request.endId() == null ? defaults.getEndId() : request.endId(),
            request == null || request.workerCount() == null ? defaults.getWorkerCount() : request.workerCount()
        );
        supervisor.startAsync(config);
        return ResponseEntity.accepted().body(supervisor.status());
    }

    @PostMapping("/cancel")
    public ScrapeRunStatusResponse cancel() {
        supervisor.cancel();
        return supervisor.status();
    }

    @GetMapping("/status")
    public ScrapeRunStatusResponse status() {
        return supervisor.status();
    }
}

package com.abroadhelper.resources.api;

import com.abroadhelper.resources.model.ScrapeRunSummary;
import com.abroadhelper.resources.scrape.SourceScrapeService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/scrape")
public class ScrapeController {
    private final SourceScrapeService scrapeService;

    public ScrapeController(SourceScrapeService scrapeService) {
        this.scrapeService = scrapeService;
    }

    @PostMapping("/run")
    public ScrapeRunSummary run(
        @RequestParam(name = "source", required = false, defaultValue = "all") String source,
        @RequestParam(name = "dryRun", required = false, defaultValue = "false") boolean dryRun
    ) {
        if ("all".equalsIgnoreCase(source.trim())) {
            return scrapeService.scrapeAll(dryRun);
        }
        try {
            return scrapeService.scrape(source.trim(), dryRun);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
    }
}

package com.delta.jobimporter.ingest.api;

import com.delta.jobimporter.config.ImporterProperties;
import com.delta.jobimporter.ingest.model.ImportRun;
import com.delta.jobimporter.ingest.model.ImportRunPage;
import com.delta.jobimporter.ingest.model.ImportRunStats;
import com.delta.jobimporter.ingest.model.ImportRunSummary;
import com.delta.jobimporter.ingest.model.QueueStats;
import com.delta.jobimporter.ingest.queue.ImportQueue;
import com.delta.jobimporter.ingest.run.ImportRunTracker;
import com.delta.jobimporter.ingest.service.ImportPipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/import")
public class ImportController {
    private final ImportPipelineService pipelineService;
    private final ImportRunTracker runTracker;
    private final ImportQueue queue;
    private final ImporterProperties properties;

    public ImportController(
        ImportPipelineService pipelineService,
        ImportRunTracker runTracker,
        ImportQueue queue,
        ImporterProperties properties
    ) {
        this.pipelineService = pipelineService;
        this.runTracker = runTracker;
        this.queue = queue;
        this.properties = properties;
    }

    /**
     * Starts an import over the posted URLs, or over the configured feed URLs when none are
     * posted.
     */
    @PostMapping("/start")
    public ResponseEntity<ImportRunSummary> start(@RequestBody(required = false) ImportStartRequest request) {
        List<String> urls = request == null || request.urls() == null || request.urls().isEmpty()
            ? properties.getSchedule().getFeedUrls()
            : request.urls();
        ImportRunSummary summary = pipelineService.runImport(urls);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(summary);
    }

    @GetMapping("/logs")
    public ImportRunPage logs(
        @RequestParam(name = "page", required = false, defaultValue = "1") int page,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return runTracker.list(page, limit);
    }

    @GetMapping("/logs/{id}")
    public ImportRun log(@PathVariable("id") long id) {
        return runTracker.getById(id);
    }

    @GetMapping("/stats")
    public ImportRunStats stats() {
        return runTracker.getAggregateStats();
    }

    @GetMapping("/queue/stats")
    public QueueStats queueStats() {
        return queue.stats();
    }

    @PostMapping("/queue/pause")
    public QueueStats pause() {
        queue.pause();
        return queue.stats();
    }

    @PostMapping("/queue/resume")
    public QueueStats resume() {
        queue.resume();
        return queue.stats();
    }
}

package com.delta.jobimporter.ingest.api;

import com.delta.jobimporter.ingest.model.JobStats;
import com.delta.jobimporter.ingest.queue.QueueWorkerService;
import com.delta.jobimporter.ingest.service.JobStatsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class JobController {
    private final JobStatsService jobStatsService;
    private final QueueWorkerService workerService;
    private final Clock clock;

    public JobController(JobStatsService jobStatsService, QueueWorkerService workerService, Clock clock) {
        this.jobStatsService = jobStatsService;
        this.workerService = workerService;
        this.clock = clock;
    }

    @GetMapping("/api/jobs/stats")
    public JobStats jobStats() {
        return jobStatsService.getStats();
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", clock.instant().toString());
        body.put("workersRunning", workerService.isRunning());
        body.put("activeWorkers", workerService.getActiveWorkerCount());
        return body;
    }
}

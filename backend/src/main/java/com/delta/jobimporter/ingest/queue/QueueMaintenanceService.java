package com.delta.jobimporter.ingest.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class QueueMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(QueueMaintenanceService.class);

    private final ImportQueue queue;

    public QueueMaintenanceService(ImportQueue queue) {
        this.queue = queue;
    }

    @Scheduled(
        fixedDelayString = "${importer.queue.purge-interval-ms:60000}",
        initialDelayString = "${importer.queue.purge-interval-ms:60000}"
    )
    public void purgeExpiredItems() {
        try {
            int deleted = queue.purgeExpired();
            if (deleted > 0) {
                log.info("Purged {} finished queue item(s)", deleted);
            }
        } catch (Exception e) {
            log.warn("Queue purge failed", e);
        }
    }
}

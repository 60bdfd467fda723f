package com.odedia.contracts.jobs;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import com.odedia.contracts.services.ContractBatchService;

/**
 * Scheduled job to clean up batch staging directories left behind by runs
 * that did not finish, e.g. when the process was killed mid-batch.
 *
 * Runs daily at 2 AM and deletes {@code contract-batch-*} directories under
 * the temp root that were last modified before the cutoff.
 */
@Component
public class StaleBatchDirectoryCleanupJob {

    private static final Logger logger = LoggerFactory.getLogger(StaleBatchDirectoryCleanupJob.class);

    private final Path tempRoot;
    private final int maxAgeHours;
    private final boolean enabled;

    public StaleBatchDirectoryCleanupJob(
            @Value("${app.cleanup.tempRoot:${java.io.tmpdir}}") String tempRoot,
            @Value("${app.cleanup.maxAgeHours:24}") int maxAgeHours,
            @Value("${app.cleanup.enabled:true}") boolean enabled) {
        this.tempRoot = Paths.get(tempRoot);
        this.maxAgeHours = maxAgeHours;
        this.enabled = enabled;

        logger.info("Initialized StaleBatchDirectoryCleanupJob: enabled={}, maxAgeHours={}, tempRoot={}",
                enabled, maxAgeHours, tempRoot);
    }

    /**
     * Runs daily at 2 AM to clean up stale staging directories.
     */
    @Scheduled(cron = "0 0 2 * * *")
    public void cleanupStaleDirectories() {
        if (!enabled) {
            logger.debug("Batch directory cleanup is disabled, skipping");
            return;
        }

        Instant cutoffTime = Instant.now().minus(maxAgeHours, ChronoUnit.HOURS);
        logger.info("Starting batch directory cleanup. Removing directories not modified since: {}", cutoffTime);

        int deletedCount = deleteOlderThan(cutoffTime);

        logger.info("Batch directory cleanup complete. Deleted {} stale directories", deletedCount);
    }

    /**
     * Manual trigger for cleanup (for admin use).
     *
     * @return Number of directories deleted
     */
    public int triggerManualCleanup() {
        Instant cutoffTime = Instant.now().minus(maxAgeHours, ChronoUnit.HOURS);
        int deletedCount = deleteOlderThan(cutoffTime);
        logger.info("Manual batch directory cleanup complete. Deleted {} stale directories", deletedCount);
        return deletedCount;
    }

    int deleteOlderThan(Instant cutoffTime) {
        if (!Files.isDirectory(tempRoot)) {
            return 0;
        }
        int deletedCount = 0;
        try (DirectoryStream<Path> candidates = Files.newDirectoryStream(tempRoot,
                ContractBatchService.RUN_DIRECTORY_PREFIX + "*")) {
            for (Path candidate : candidates) {
                if (Files.isDirectory(candidate) && isOlderThan(candidate, cutoffTime)) {
                    try {
                        FileSystemUtils.deleteRecursively(candidate);
                        deletedCount++;
                        logger.debug("Deleted stale directory {}", candidate);
                    } catch (IOException e) {
                        logger.warn("Could not delete {}: {}", candidate, e.getMessage());
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("Could not list {}: {}", tempRoot, e.getMessage());
        }
        return deletedCount;
    }

    private boolean isOlderThan(Path directory, Instant cutoffTime) {
        try {
            return Files.getLastModifiedTime(directory).toInstant().isBefore(cutoffTime);
        } catch (IOException e) {
            logger.warn("Could not read modification time of {}: {}", directory, e.getMessage());
            return false;
        }
    }
}

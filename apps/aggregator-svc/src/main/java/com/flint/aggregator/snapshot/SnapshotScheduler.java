package com.flint.aggregator.snapshot;

import com.flint.aggregator.repository.ConnectionRepository;
import com.flint.aggregator.security.RequestContextFilter;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily net-worth snapshot for every user with an active connection. One user's failure is counted
 * and the run moves on; nothing escapes a run.
 *
 * <p>Runs have no per-user deadline. They stay bounded because every provider call is cut off by the
 * provider's request timeout and the bounded retry policy.
 */
@Component
public class SnapshotScheduler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotScheduler.class);

    private final ConnectionRepository connectionRepository;
    private final NetWorthSnapshotService snapshotService;

    public SnapshotScheduler(ConnectionRepository connectionRepository, NetWorthSnapshotService snapshotService) {
        this.connectionRepository = connectionRepository;
        this.snapshotService = snapshotService;
    }

    @Scheduled(cron = "${flint.snapshot.cron:0 0 0 * * *}", zone = "${flint.snapshot.zone:America/New_York}")
    public void runOnSchedule() {
        run("scheduled");
    }

    public SnapshotRunResult runDailySnapshots() {
        return run("inline");
    }

    private SnapshotRunResult run(String source) {
        boolean ownTrace = MDC.get(RequestContextFilter.MDC_KEY) == null;
        if (ownTrace) {
            MDC.put(RequestContextFilter.MDC_KEY, "snapshot-" + UUID.randomUUID());
        }
        try {
            List<UUID> userIds;
            try {
                userIds = connectionRepository.findUserIdsWithActiveConnections();
            } catch (RuntimeException e) {
                log.error("Net worth snapshots ({}): could not list users", source, e);
                return new SnapshotRunResult(0, 0);
            }
            log.info("Net worth snapshots ({}): starting for {} user(s)", source, userIds.size());
            int success = 0;
            int failed = 0;
            for (UUID userId : userIds) {
                try {
                    snapshotService.createSnapshot(userId);
                    success++;
                } catch (SnapshotAggregationException e) {
                    failed++;
                    log.warn("Net worth snapshot skipped for user {}: {}", userId, e.getMessage());
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Net worth snapshot failed for user {}", userId, e);
                }
            }
            log.info("Net worth snapshots ({}) complete: {} success, {} failed", source, success, failed);
            return new SnapshotRunResult(success, failed);
        } finally {
            if (ownTrace) {
                MDC.remove(RequestContextFilter.MDC_KEY);
            }
        }
    }
}

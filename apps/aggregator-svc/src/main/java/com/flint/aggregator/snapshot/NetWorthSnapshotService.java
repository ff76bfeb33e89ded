package com.flint.aggregator.snapshot;

import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.model.NetWorthSnapshot;
import com.flint.aggregator.repository.SnapshotRepository;
import com.flint.aggregator.service.AccountAggregationService;
import com.flint.aggregator.service.AggregationResult;
import com.flint.aggregator.service.NetWorthBreakdown;
import com.flint.aggregator.service.NetWorthCalculator;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NetWorthSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(NetWorthSnapshotService.class);

    static final int MAX_HISTORY_DAYS = 366;

    private final AccountAggregationService aggregationService;
    private final NetWorthCalculator calculator;
    private final SnapshotRepository snapshotRepository;
    private final ZoneId zone;
    private final Clock clock;

    public NetWorthSnapshotService(
            AccountAggregationService aggregationService,
            NetWorthCalculator calculator,
            SnapshotRepository snapshotRepository,
            FlintProperties properties,
            Clock clock
    ) {
        this.aggregationService = aggregationService;
        this.calculator = calculator;
        this.snapshotRepository = snapshotRepository;
        this.zone = properties.snapshot().zoneId();
        this.clock = clock;
    }

    /**
     * Refreshes the user's accounts and writes today's row, replacing one written earlier today.
     *
     * @throws SnapshotAggregationException if any connection failed to refresh
     */
    public NetWorthSnapshot createSnapshot(UUID userId) {
        AggregationResult result = aggregationService.refreshAccounts(userId);
        if (result.hasFailures()) {
            throw new SnapshotAggregationException(userId, result.failures());
        }
        NetWorthBreakdown breakdown = calculator.calculate(aggregationService.activeAccounts(userId));
        NetWorthSnapshot snapshot = new NetWorthSnapshot(
                userId,
                today(),
                breakdown.total(),
                breakdown.bank(),
                breakdown.investment(),
                breakdown.crypto(),
                breakdown.debt(),
                clock.instant()
        );
        snapshotRepository.upsertSnapshot(snapshot);
        log.debug("Net worth snapshot for user {} on {}: {}", userId, snapshot.date(), snapshot.totalBalance());
        return snapshot;
    }

    /**
     * Rows of the last {@code days} days including today, oldest first.
     */
    public List<NetWorthSnapshot> snapshotHistory(UUID userId, int days) {
        if (days < 1 || days > MAX_HISTORY_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_HISTORY_DAYS);
        }
        return snapshotRepository.findByUserIdSince(userId, today().minusDays(days - 1L));
    }

    LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }
}

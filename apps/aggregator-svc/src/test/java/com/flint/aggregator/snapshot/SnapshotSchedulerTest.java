package com.flint.aggregator.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flint.aggregator.connection.ConnectionVerdict;
import com.flint.aggregator.connection.VerdictKind;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.model.AccountType;
import com.flint.aggregator.model.ProviderConnection;
import com.flint.aggregator.repository.InMemoryConnectionRepository;
import com.flint.aggregator.repository.InMemorySnapshotRepository;
import com.flint.aggregator.service.AccountAggregationService;
import com.flint.aggregator.service.AggregationResult;
import com.flint.aggregator.service.ConnectionFailure;
import com.flint.aggregator.service.NetWorthCalculator;
import com.flint.aggregator.support.Accounts;
import com.flint.aggregator.support.MutableClock;
import com.flint.aggregator.support.TestProperties;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.MDC;

class SnapshotSchedulerTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2024, 6, 1);

    @Mock
    private AccountAggregationService aggregationService;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T16:00:00Z"));
    private final InMemoryConnectionRepository connections = new InMemoryConnectionRepository();
    private final InMemorySnapshotRepository snapshots = new InMemorySnapshotRepository();
    private final UUID first = UUID.randomUUID();
    private final UUID second = UUID.randomUUID();
    private final UUID third = UUID.randomUUID();
    private SnapshotScheduler scheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        NetWorthSnapshotService snapshotService = new NetWorthSnapshotService(
                aggregationService, new NetWorthCalculator(), snapshots, TestProperties.defaults(), clock);
        scheduler = new SnapshotScheduler(connections, snapshotService);
        link(first, "conn_1");
        link(second, "conn_2");
        link(third, "conn_3");
    }

    private void link(UUID userId, String connectionId) {
        clock.advance(Duration.ofSeconds(1));
        connections.save(new ProviderConnection(connectionId, userId, AccountProvider.BANK, "secret", true, clock.instant()));
        when(aggregationService.refreshAccounts(userId)).thenReturn(new AggregationResult(List.of(), List.of()));
        when(aggregationService.activeAccounts(userId))
                .thenReturn(List.of(Accounts.asset("chk_" + connectionId, AccountType.DEPOSITORY, "100.00")));
    }

    @Test
    void oneUserFailingDoesNotStopTheRun() {
        when(aggregationService.refreshAccounts(second)).thenThrow(new IllegalStateException("database unavailable"));

        SnapshotRunResult result = scheduler.runDailySnapshots();

        assertThat(result).isEqualTo(new SnapshotRunResult(2, 1));
        assertThat(snapshots.findByUserIdSince(first, RUN_DATE)).hasSize(1);
        assertThat(snapshots.findByUserIdSince(second, RUN_DATE)).isEmpty();
        assertThat(snapshots.findByUserIdSince(third, RUN_DATE)).hasSize(1);
    }

    @Test
    void partialRefreshCountsAsFailure() {
        ConnectionFailure failure = new ConnectionFailure("conn_3", AccountProvider.BANK, null,
                new ConnectionVerdict(VerdictKind.TRANSIENT, 429, null));
        when(aggregationService.refreshAccounts(third)).thenReturn(new AggregationResult(List.of(), List.of(failure)));

        SnapshotRunResult result = scheduler.runDailySnapshots();

        assertThat(result.success()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.total()).isEqualTo(3);
    }

    @Test
    void deactivatedConnectionsAreSkipped() {
        connections.deactivate("conn_2");

        assertThat(scheduler.runDailySnapshots()).isEqualTo(new SnapshotRunResult(2, 0));
    }

    @Test
    void runLeavesNoTraceIdBehind() {
        scheduler.runOnSchedule();

        assertThat(MDC.get("trace_id")).isNull();
    }
}

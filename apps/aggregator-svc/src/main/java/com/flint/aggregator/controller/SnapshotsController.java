package com.flint.aggregator.controller;

import com.flint.aggregator.controller.dto.SnapshotResponseDto;
import com.flint.aggregator.controller.dto.SnapshotRunResponseDto;
import com.flint.aggregator.controller.dto.SnapshotsResponseDto;
import com.flint.aggregator.security.CurrentUserProvider;
import com.flint.aggregator.snapshot.NetWorthSnapshotService;
import com.flint.aggregator.snapshot.SnapshotRunResult;
import com.flint.aggregator.snapshot.SnapshotScheduler;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/snapshots")
public class SnapshotsController {

    private final NetWorthSnapshotService snapshotService;
    private final SnapshotScheduler snapshotScheduler;
    private final CurrentUserProvider currentUserProvider;

    public SnapshotsController(
            NetWorthSnapshotService snapshotService,
            SnapshotScheduler snapshotScheduler,
            CurrentUserProvider currentUserProvider
    ) {
        this.snapshotService = snapshotService;
        this.snapshotScheduler = snapshotScheduler;
        this.currentUserProvider = currentUserProvider;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public SnapshotsResponseDto history(@RequestParam(defaultValue = "30") int days) {
        UUID userId = currentUserProvider.requireCurrentUserId();
        return new SnapshotsResponseDto(
                days,
                snapshotService.snapshotHistory(userId, days).stream().map(SnapshotResponseDto::from).toList(),
                AccountsController.traceId()
        );
    }

    // operator trigger; the daily run happens on its own schedule
    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public SnapshotRunResponseDto run() {
        SnapshotRunResult result = snapshotScheduler.runDailySnapshots();
        return new SnapshotRunResponseDto(result.success(), result.failed(), AccountsController.traceId());
    }
}

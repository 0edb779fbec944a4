package net.tollgate.integration.spring.sched;

import net.tollgate.core.maintenance.MaintenanceService;
import net.tollgate.core.scheduler.SchedulerSyncer;
import net.tollgate.core.workstealing.WorkStealingCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.TimeUnit;

public class TollgateSchedulers {
    private static final Logger log = LoggerFactory.getLogger(TollgateSchedulers.class);

    private final SchedulerSyncer syncer;
    private final WorkStealingCoordinator workStealing;
    private final MaintenanceService maintenance;

    private boolean refreshDescriptions = false;

    public TollgateSchedulers(SchedulerSyncer syncer,
                              WorkStealingCoordinator workStealing,
                              MaintenanceService maintenance) {
        this.syncer = syncer;
        this.workStealing = workStealing;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${tollgate.scheduler.syncer-interval-secs:5}", timeUnit = TimeUnit.SECONDS)
    public void syncScheduler() {
        syncer.syncOnce();
    }

    @Scheduled(fixedDelayString = "${tollgate.work-stealing.offer-help-interval-ms:100}")
    public void offerHelp() {
        workStealing.offerHelpOnce();
    }

    @Scheduled(fixedDelayString = "${tollgate.scheduler.maintenance-delay-ms:1000}")
    public void maintenance() {
        var report = maintenance.runOnce(refreshDescriptions);
        if (report.reapedResponders > 0) log.info("maintenance: {}", report);
        else log.debug("maintenance: {}", report);
    }

    public void setRefreshDescriptions(boolean refreshDescriptions) {
        this.refreshDescriptions = refreshDescriptions;
    }
}

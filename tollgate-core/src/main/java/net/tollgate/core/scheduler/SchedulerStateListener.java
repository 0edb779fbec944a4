package net.tollgate.core.scheduler;

import net.tollgate.core.model.SchedulerSnapshot;

/** 스케줄러 스냅샷 구독자 (dispatcher, interstitial gate) */
@FunctionalInterface
public interface SchedulerStateListener {
    void onSchedulerSnapshot(SchedulerSnapshot snapshot);
}

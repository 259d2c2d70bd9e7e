package io.droplite.server.relayer;

import io.droplite.core.Category;
import io.droplite.storage.DistributionLedger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically submits the current day's distributions for every category.
 * <p>
 *  - One run at a time: single-threaded scheduler with fixed delay.
 *  - Every category is run each pass; sub-batches already finalized are reported
 *    as ALREADY_SUBMITTED by the submitter, so a sub-batch that failed earlier is
 *    retried on the next pass.
 *  - A failure in one category is logged and does not stop the others.
 */
public final class DailyDistributionScheduler {
    private static final Logger log = Logger.getLogger(DailyDistributionScheduler.class.getName());

    private final DistributionLedger ledger;
    private final BatchSubmitter submitter;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public DailyDistributionScheduler(DistributionLedger ledger, BatchSubmitter submitter, Duration interval) {
        this.ledger = ledger;
        this.submitter = submitter;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "distribution-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(
                this::tickSafe,
                5L,
                interval.toSeconds(),
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    /** One pass over all categories of the given day. */
    public List<BatchSubmitter.Report> runOnce(long day) {
        List<BatchSubmitter.Report> reports = new ArrayList<>();
        for (Category category : Category.values()) {
            try {
                reports.add(submitter.submitDay(day, category));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Distribution run for " + day + "/" + category + " failed", e);
            }
        }
        return reports;
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            runOnce(ledger.currentDay());
        } catch (Exception e) {
            log.log(Level.WARNING, "scheduler tick failed", e);
        }
    }
}

package io.droplite.server;

import io.droplite.server.claim.ClaimProcessor;
import io.droplite.server.claim.EscrowValueTransfer;
import io.droplite.server.distribution.DistributionConfig;
import io.droplite.server.distribution.LoggingEventListener;
import io.droplite.server.distribution.StaticRelayerAuthorization;
import io.droplite.server.distribution.SubmissionValidator;
import io.droplite.server.relayer.BatchArchive;
import io.droplite.server.relayer.BatchSubmitter;
import io.droplite.server.relayer.DailyDistributionScheduler;
import io.droplite.server.relayer.JsonFileRewardSource;
import io.droplite.server.signing.TypedDataSigner;
import io.droplite.storage.DurableLedger;
import io.droplite.storage.FileSnapshotter;
import io.droplite.storage.FileWal;
import io.droplite.storage.SnapshotPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a distribution node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI and the JSON policy.
 *  - Wire storage (WAL, snapshots, DurableLedger).
 *  - Build the validator, claim processor and escrow.
 *  - Optionally start the relayer scheduler when a signing key is configured.
 *  - Start the HTTP API.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        DistributionConfig policy = cfg.configPath() == null
                ? DistributionConfig.defaults()
                : DistributionConfig.fromJsonFile(Path.of(cfg.configPath()));
        Clock clock = Clock.systemUTC();

        // ------ Storage Layer -------
        var wal = new FileWal(Path.of(cfg.walDir()), policy.walRotateBytes());
        var snaps = new FileSnapshotter(Path.of(cfg.snapDir()));
        var ledger = new DurableLedger(wal, snaps, new SnapshotPolicy(policy.snapshotEveryOps()), clock);

        // ------ Distribution + claims -------
        TypedDataSigner signer = cfg.relayerEnabled()
                ? TypedDataSigner.fromPrivateKey(cfg.relayerKey(), policy.domain())
                : null;
        List<String> relayers = new ArrayList<>(policy.relayers());
        if (signer != null && !relayers.contains(signer.address())) relayers.add(signer.address());

        var auth = new StaticRelayerAuthorization(relayers);
        var validator = new SubmissionValidator(ledger, auth, policy, clock);
        var escrow = new EscrowValueTransfer(policy.escrowFunding());
        var claims = new ClaimProcessor(ledger, escrow);
        var events = new LoggingEventListener();
        validator.addListener(events);
        claims.addListener(events);

        var archive = new BatchArchive();
        if (cfg.rewardsDir() != null && !cfg.rewardsDir().isBlank()) {
            archive.restore(ledger, new JsonFileRewardSource(Path.of(cfg.rewardsDir())), policy.maxBatchSize());
        }

        // ------ Relayer (optional) ------
        DailyDistributionScheduler scheduler = null;
        if (signer != null) {
            var submitter = new BatchSubmitter(new JsonFileRewardSource(Path.of(cfg.rewardsDir())),
                    validator, ledger, signer, archive, clock, Duration.ofMinutes(10));
            scheduler = new DailyDistributionScheduler(ledger, submitter, policy.schedulerInterval());
            scheduler.start();
            log.info("Relayer " + signer.address() + " scheduled every " + policy.schedulerInterval());
        }

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), validator, claims, ledger, archive);
        web.start();
        log.info(String.format("Distribution node listening on http://localhost:%d (day %d, policy %s)",
                cfg.httpPort(), ledger.currentDay(), policy.rootPolicy()));

        // Shutdown hook
        final DailyDistributionScheduler toStop = scheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (toStop != null) toStop.stop();
                web.stop();
                ledger.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "shutdown failed", e);
            }
        }));
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            log.log(Level.WARNING, "could not load logging.properties", e);
        }
    }
}

package io.droplite.server.distribution;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.droplite.core.Category;
import io.droplite.server.dto.JsonDistributionConfig;
import io.droplite.server.signing.TypedDataDomain;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Distribution policy: signing domain, batch limits, daily caps, relayers and
 * storage tuning.
 * <p>
 * Loaded from JSON. Values missing from a file fall back to the classpath
 * defaults in {@code distribution-defaults.json}.
 */
public final class DistributionConfig {

    static final String DEFAULTS_RESOURCE = "/distribution-defaults.json";
    private static final int TOKEN_DECIMALS = 18;

    private final TypedDataDomain domain;
    private final int maxBatchSize;
    private final Map<Category, BigInteger> dailyCaps;
    private final List<String> relayers;
    private final RootTrustPolicy rootPolicy;
    private final BigInteger escrowFunding;
    private final Duration schedulerInterval;
    private final long walRotateBytes;
    private final int snapshotEveryOps;

    public DistributionConfig(
            TypedDataDomain domain,
            int maxBatchSize,
            Map<Category, BigInteger> dailyCaps,
            List<String> relayers,
            RootTrustPolicy rootPolicy,
            BigInteger escrowFunding,
            Duration schedulerInterval,
            long walRotateBytes,
            int snapshotEveryOps
    ) {
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEveryOps <= 0) throw new IllegalArgumentException("snapshotEveryOps must be > 0");
        if (escrowFunding.signum() < 0) throw new IllegalArgumentException("escrowFunding must be >= 0");
        if (schedulerInterval.isNegative() || schedulerInterval.isZero()) {
            throw new IllegalArgumentException("schedulerInterval must be > 0");
        }
        for (Category c : Category.values()) {
            BigInteger cap = dailyCaps.get(c);
            if (cap == null) throw new IllegalArgumentException("missing daily cap for " + c);
            if (cap.signum() < 0) throw new IllegalArgumentException("daily cap for " + c + " must be >= 0");
        }

        this.domain = Objects.requireNonNull(domain, "domain");
        this.maxBatchSize = maxBatchSize;
        this.dailyCaps = Map.copyOf(dailyCaps);
        this.relayers = List.copyOf(relayers);
        this.rootPolicy = Objects.requireNonNull(rootPolicy, "rootPolicy");
        this.escrowFunding = escrowFunding;
        this.schedulerInterval = schedulerInterval;
        this.walRotateBytes = walRotateBytes;
        this.snapshotEveryOps = snapshotEveryOps;
    }

    /** Classpath defaults only. */
    public static DistributionConfig defaults() {
        return fromDto(readDefaults(new ObjectMapper()));
    }

    /** Defaults overlaid with the fields present in the given file. */
    public static DistributionConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonDistributionConfig cfg = mapper.readerForUpdating(readDefaults(mapper)).readValue(path.toFile());
            return fromDto(cfg);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load DistributionConfig from " + path, e);
        }
    }

    private static JsonDistributionConfig readDefaults(ObjectMapper mapper) {
        try (InputStream in = DistributionConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new IllegalStateException("missing classpath resource " + DEFAULTS_RESOURCE);
            return mapper.readValue(in, JsonDistributionConfig.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
    }

    private static DistributionConfig fromDto(JsonDistributionConfig cfg) {
        var domain = new TypedDataDomain(cfg.domain.name, cfg.domain.version, cfg.domain.chainId,
                cfg.domain.verifyingContract);

        Map<Category, BigInteger> caps = new EnumMap<>(Category.class);
        cfg.dailyCaps.forEach((name, amount) -> caps.put(Category.parse(name), toWei(amount)));

        return new DistributionConfig(
                domain,
                cfg.maxBatchSize,
                caps,
                cfg.relayers == null ? List.of() : cfg.relayers,
                RootTrustPolicy.valueOf(cfg.rootPolicy.trim().toUpperCase()),
                toWei(cfg.escrowFunding),
                Duration.ofSeconds(cfg.schedulerIntervalSeconds),
                cfg.walRotateBytes,
                cfg.snapshotEveryOps
        );
    }

    /** Decimal token amount to its 18-decimal integer form; rejects sub-wei precision. */
    public static BigInteger toWei(String tokens) {
        try {
            return new BigDecimal(tokens.trim()).movePointRight(TOKEN_DECIMALS).toBigIntegerExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("invalid token amount: " + tokens, e);
        }
    }

    public TypedDataDomain domain() {
        return domain;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    public BigInteger dailyCap(Category category) {
        return dailyCaps.get(category);
    }

    public Map<Category, BigInteger> dailyCaps() {
        return dailyCaps;
    }

    public List<String> relayers() {
        return relayers;
    }

    public RootTrustPolicy rootPolicy() {
        return rootPolicy;
    }

    public BigInteger escrowFunding() {
        return escrowFunding;
    }

    public Duration schedulerInterval() {
        return schedulerInterval;
    }

    public long walRotateBytes() {
        return walRotateBytes;
    }

    public int snapshotEveryOps() {
        return snapshotEveryOps;
    }

    /** Copy with a different root policy. */
    public DistributionConfig withRootPolicy(RootTrustPolicy policy) {
        return new DistributionConfig(domain, maxBatchSize, dailyCaps, relayers, policy, escrowFunding,
                schedulerInterval, walRotateBytes, snapshotEveryOps);
    }

    /** Copy with a different relayer list. */
    public DistributionConfig withRelayers(List<String> newRelayers) {
        return new DistributionConfig(domain, maxBatchSize, dailyCaps, newRelayers, rootPolicy, escrowFunding,
                schedulerInterval, walRotateBytes, snapshotEveryOps);
    }

    /** Copy with a different batch size limit. */
    public DistributionConfig withMaxBatchSize(int size) {
        return new DistributionConfig(domain, size, dailyCaps, relayers, rootPolicy, escrowFunding,
                schedulerInterval, walRotateBytes, snapshotEveryOps);
    }
}

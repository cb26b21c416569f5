package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.exception.ContinueWaitException;
import com.cube.orchestrator.domain.exception.NoMatchingRollupException;
import com.cube.orchestrator.domain.exception.PartitionsNotReadyException;
import com.cube.orchestrator.domain.exception.QueryExecutionException;
import com.cube.orchestrator.domain.model.CompiledModel;
import com.cube.orchestrator.domain.model.PreAggregationDefinition;
import com.cube.orchestrator.domain.model.PreAggregationOptions;
import com.cube.orchestrator.domain.model.PreAggregationPartition;
import com.cube.orchestrator.domain.model.PreAggregationUsage;
import com.cube.orchestrator.domain.model.QueryRequest;
import com.cube.orchestrator.domain.model.RefreshKey;
import com.cube.orchestrator.domain.model.TimeRange;
import com.cube.orchestrator.infrastructure.driver.QueryDriver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keeps the partitions of pre-aggregations built and fresh.
 *
 * Table Layout:
 * - one table per partition: {@code <schema>.<name>_<version hash>_<built at epoch seconds>}
 * - the version hash covers the build SQL, the partition's time range and the refresh-key
 *   value, so a change of any of them builds a new table next to the old one
 * - a superseded table is dropped by {@link #dropExpiredPartitions} once its successor has
 *   been serving for {@code supersededTableGracePeriod}, so queries already rewritten to it
 *   can still finish
 *
 * Builds run in the instance's pre-aggregation queue, separate from queries,
 * and are deduplicated by partition and version.
 *
 * With externalRefresh the manager never builds: it only looks up tables built
 * by another process (the refresh worker) through the data source's table listing.
 */
@Slf4j
public class PreAggregationManager {

    private static final Pattern VERSIONED_TABLE = Pattern.compile("^(.+)_([0-9a-f]{8})_(\\d+)$");
    private static final int BUILD_PRIORITY = 0;

    private final QueryQueue buildQueue;
    private final Function<String, QueryDriver> drivers;
    private final RefreshKeyCache refreshKeyCache;
    private final Function<RefreshKey, String> refreshKeyEvaluator;
    private final PartitionPlanner planner;
    private final PreAggregationOptions options;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // dataSource|schema.partitionName -> latest known version
    private final Map<String, PreAggregationPartition> partitions = new ConcurrentHashMap<>();
    private final Map<String, TableListing> listings = new ConcurrentHashMap<>();

    public PreAggregationManager(QueryQueue buildQueue, Function<String, QueryDriver> drivers,
                                 RefreshKeyCache refreshKeyCache, Function<RefreshKey, String> refreshKeyEvaluator,
                                 PreAggregationOptions options, MeterRegistry meterRegistry, Clock clock) {
        this.buildQueue = buildQueue;
        this.drivers = drivers;
        this.refreshKeyCache = refreshKeyCache;
        this.refreshKeyEvaluator = refreshKeyEvaluator;
        this.planner = new PartitionPlanner(options.getMaxPartitions());
        this.options = options;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Makes sure every partition covering {@code range} and {@code buckets} exists and is fresh.
     *
     * @param range       null means the definition's whole retention window
     * @param continueWait how long to wait for builds; null waits until they finish
     * @return partitions ordered by name
     * @throws com.cube.orchestrator.domain.exception.CapacityExceededException if too many partitions are needed
     * @throws ContinueWaitException if builds are still running when {@code continueWait} elapses
     */
    public List<PreAggregationPartition> ensurePartitions(PreAggregationDefinition definition, String schema,
                                                          TimeRange range, List<String> buckets, ZoneId zone,
                                                          Duration continueWait) {
        TimeRange effectiveRange = range != null ? range : defaultRange(definition, zone);
        List<PartitionSpec> specs = planner.plan(definition, effectiveRange, buckets, zone);

        if (options.isExternalRefresh()) {
            return findExternal(definition, schema, specs);
        }

        String token = freshnessToken(definition);
        Instant now = clock.instant();
        List<PreAggregationPartition> ready = new ArrayList<>();
        List<String> builds = new ArrayList<>();

        for (PartitionSpec spec : specs) {
            PreAggregationPartition current = current(definition, schema, spec);
            String version = versionHash(definition, spec, token);
            if (current != null && (version.equals(current.getVersionHash()) || isImmutable(definition, spec, now))) {
                ready.add(current);
            } else {
                builds.add(enqueueBuild(definition, schema, spec, version));
            }
        }

        if (!builds.isEmpty()) {
            log.debug("Waiting for {} partition build(s) of {}", builds.size(), definition.getId());
            long deadline = continueWait == null ? -1 : System.nanoTime() + continueWait.toNanos();
            for (String handle : builds) {
                ready.add((PreAggregationPartition) awaitBuild(handle, deadline));
            }
        }

        ready.sort(Comparator.comparing(PreAggregationPartition::getPartitionName));
        return ready;
    }

    /**
     * True if the query references at least one pre-aggregation and all of them are defined.
     */
    public boolean rollupOnlyCheck(QueryRequest query, CompiledModel model) {
        List<PreAggregationUsage> usages = query.getPreAggregations();
        return usages != null && !usages.isEmpty()
                && usages.stream().allMatch(usage -> model.findPreAggregation(usage.getPreAggregationId()).isPresent());
    }

    /**
     * Replaces the usage's placeholder with the partition table, or a union of all partition tables.
     */
    public String rewriteQuery(String sql, PreAggregationUsage usage, List<PreAggregationPartition> partitions) {
        if (partitions.isEmpty()) {
            throw new NoMatchingRollupException("No partitions of pre-aggregation '" + usage.getPreAggregationId() + "' to read from");
        }
        String table = partitions.size() == 1
                ? partitions.get(0).getQualifiedTableName()
                : partitions.stream()
                        .map(partition -> "SELECT * FROM " + partition.getQualifiedTableName())
                        .collect(Collectors.joining(" UNION ALL ", "(", ")"));
        if (!sql.contains(usage.getTableNamePlaceholder())) {
            log.warn("Query does not contain placeholder {} of pre-aggregation {}",
                    usage.getTableNamePlaceholder(), usage.getPreAggregationId());
        }
        return sql.replace(usage.getTableNamePlaceholder(), table);
    }

    /**
     * Builds the retention window of every definition and drops partitions that left it.
     * A failing definition does not stop the others; the first failure is rethrown at the end.
     *
     * @return number of partitions that are now up to date
     */
    public int refresh(List<PreAggregationDefinition> definitions, String schema, ZoneId zone) {
        if (options.isExternalRefresh()) {
            log.debug("External refresh is enabled, not building pre-aggregations");
            return 0;
        }
        int refreshed = 0;
        RuntimeException firstFailure = null;
        int failures = 0;
        for (PreAggregationDefinition definition : definitions) {
            try {
                List<PreAggregationPartition> current = ensurePartitions(definition, schema, null, null, zone, null);
                refreshed += current.size();
                dropExpiredPartitions(definition, schema, current);
            } catch (RuntimeException e) {
                log.error("Refresh of pre-aggregation {} failed", definition.getId(), e);
                failures++;
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw new QueryExecutionException(failures + " of " + definitions.size()
                    + " pre-aggregations failed to refresh: " + firstFailure.getMessage(), firstFailure);
        }
        return refreshed;
    }

    /**
     * Drops tables of the definition that are no longer needed next to {@code current}:
     * partitions that end before the retention window, and versions of current partitions
     * superseded by a table that has been serving for the grace period.
     * Partitions planned for other time zones are kept while they overlap the window.
     */
    public int dropExpiredPartitions(PreAggregationDefinition definition, String schema, List<PreAggregationPartition> current) {
        if (current.isEmpty()) {
            return 0;
        }
        QueryDriver driver = drivers.apply(definition.getDataSource());
        Map<String, PreAggregationPartition> currentByName = current.stream()
                .collect(Collectors.toMap(PreAggregationPartition::getPartitionName, p -> p, (a, b) -> a, LinkedHashMap::new));
        Instant windowStart = definition.isPartitioned() && definition.getRetention() != null
                ? current.stream()
                        .map(PreAggregationPartition::getRange)
                        .filter(Objects::nonNull)
                        .map(TimeRange::getFrom)
                        .min(Comparator.naturalOrder())
                        .orElse(null)
                : null;
        long settledBefore = clock.instant().minus(options.getSupersededTableGracePeriod()).getEpochSecond();

        List<String> tables = tables(definition.getDataSource(), schema);
        // partition name -> build time of its newest table that has served for the grace period
        Map<String, Long> settled = new HashMap<>();
        for (String table : tables) {
            Matcher matcher = VERSIONED_TABLE.matcher(table);
            if (matcher.matches() && currentByName.containsKey(matcher.group(1))) {
                long builtAt = Long.parseLong(matcher.group(3));
                if (builtAt <= settledBefore) {
                    settled.merge(matcher.group(1), builtAt, Math::max);
                }
            }
        }

        int dropped = 0;
        for (String table : tables) {
            Matcher matcher = VERSIONED_TABLE.matcher(table);
            if (!matcher.matches()) {
                continue;
            }
            String partitionName = matcher.group(1);
            long builtAt = Long.parseLong(matcher.group(3));
            PreAggregationPartition kept = currentByName.get(partitionName);

            boolean superseded = kept != null && !kept.getTableName().equals(table)
                    && settled.containsKey(partitionName) && builtAt < settled.get(partitionName);
            boolean expired = kept == null && windowStart != null && endsBefore(definition, partitionName, windowStart);

            if (superseded || expired) {
                String qualified = schema + "." + table;
                log.info("Dropping {} partition table {}", expired ? "expired" : "superseded", qualified);
                if (dropQuietly(driver, qualified)) {
                    dropped++;
                }
                partitions.values().removeIf(partition -> partition.getQualifiedTableName().equals(qualified));
            }
        }
        if (dropped > 0) {
            listings.remove(listingKey(definition.getDataSource(), schema));
        }
        return dropped;
    }

    public int getMaxPartitions() {
        return planner.getMaxPartitions();
    }

    private List<PreAggregationPartition> findExternal(PreAggregationDefinition definition, String schema, List<PartitionSpec> specs) {
        List<PreAggregationPartition> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (PartitionSpec spec : specs) {
            PreAggregationPartition partition = discover(definition, schema, spec);
            if (partition != null) {
                found.add(partition);
            } else {
                missing.add(spec.getPartitionName());
            }
        }
        if (!missing.isEmpty()) {
            String message = "Pre-aggregation '" + definition.getId() + "' is not built yet for " + missing.size()
                    + " partition(s), e.g. " + missing.subList(0, Math.min(3, missing.size()));
            if (options.isRollupOnlyMode()) {
                throw new NoMatchingRollupException(message);
            }
            throw new PartitionsNotReadyException(message + "; waiting for the refresh worker");
        }
        found.sort(Comparator.comparing(PreAggregationPartition::getPartitionName));
        return found;
    }

    private PreAggregationPartition current(PreAggregationDefinition definition, String schema, PartitionSpec spec) {
        String key = partitionKey(definition.getDataSource(), schema, spec.getPartitionName());
        PreAggregationPartition known = partitions.get(key);
        if (known != null) {
            return known;
        }
        PreAggregationPartition discovered = discover(definition, schema, spec);
        if (discovered != null) {
            PreAggregationPartition raced = partitions.putIfAbsent(key, discovered);
            return raced != null ? raced : discovered;
        }
        return null;
    }

    private PreAggregationPartition discover(PreAggregationDefinition definition, String schema, PartitionSpec spec) {
        PreAggregationPartition latest = null;
        for (String table : tables(definition.getDataSource(), schema)) {
            Matcher matcher = VERSIONED_TABLE.matcher(table);
            if (!matcher.matches() || !matcher.group(1).equals(spec.getPartitionName())) {
                continue;
            }
            Instant builtAt = Instant.ofEpochSecond(Long.parseLong(matcher.group(3)));
            if (latest == null || builtAt.isAfter(latest.getBuiltAt())) {
                latest = PreAggregationPartition.builder()
                        .preAggregationId(definition.getId())
                        .partitionName(spec.getPartitionName())
                        .range(spec.getRange())
                        .bucket(spec.getBucket())
                        .schema(schema)
                        .tableName(table)
                        .versionHash(matcher.group(2))
                        .builtAt(builtAt)
                        .build();
            }
        }
        return latest;
    }

    private List<String> tables(String dataSource, String schema) {
        String key = listingKey(dataSource, schema);
        Instant now = clock.instant();
        TableListing listing = listings.get(key);
        if (listing == null || listing.loadedAt.plus(options.getTableListingTtl()).isBefore(now)) {
            List<String> names = drivers.apply(dataSource).listTables(schema).stream()
                    .map(name -> name.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toList());
            listing = new TableListing(names, now);
            listings.put(key, listing);
        }
        return listing.tables;
    }

    private String enqueueBuild(PreAggregationDefinition definition, String schema, PartitionSpec spec, String version) {
        String queryKey = "pre-aggregation:" + schema + "." + spec.getPartitionName() + ":" + version;
        return buildQueue.enqueue(queryKey, BUILD_PRIORITY,
                context -> build(definition, schema, spec, version), true);
    }

    private PreAggregationPartition build(PreAggregationDefinition definition, String schema, PartitionSpec spec,
                                          String version) {
        QueryDriver driver = drivers.apply(definition.getDataSource());
        Instant builtAt = clock.instant();
        PreAggregationPartition partition = PreAggregationPartition.builder()
                .preAggregationId(definition.getId())
                .partitionName(spec.getPartitionName())
                .range(spec.getRange())
                .bucket(spec.getBucket())
                .schema(schema)
                .tableName(spec.getPartitionName() + "_" + version + "_" + builtAt.getEpochSecond())
                .versionHash(version)
                .builtAt(builtAt)
                .build();
        try {
            driver.createSchemaIfNotExists(schema);
            driver.createTableAs(partition.getQualifiedTableName(), definition.getSql(), spec.getBuildParams());
        } catch (RuntimeException e) {
            countBuild("error");
            log.error("Failed to build partition {} of pre-aggregation {}", partition.getQualifiedTableName(), definition.getId(), e);
            throw e;
        }
        partitions.put(partitionKey(definition.getDataSource(), schema, spec.getPartitionName()), partition);
        listings.remove(listingKey(definition.getDataSource(), schema));
        countBuild("success");
        log.info("Built partition {} of pre-aggregation {}", partition.getQualifiedTableName(), definition.getId());
        return partition;
    }

    private Object awaitBuild(String handle, long deadlineNanos) {
        if (deadlineNanos < 0) {
            return buildQueue.awaitCompletion(handle, options.getPollInterval());
        }
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new ContinueWaitException(handle);
        }
        return buildQueue.waitForResult(handle, Duration.ofNanos(remaining));
    }

    private String freshnessToken(PreAggregationDefinition definition) {
        if (definition.getRefreshKey() == null) {
            return RefreshKeyCache.NO_REFRESH_KEY;
        }
        RefreshKey refreshKey = RefreshKeyEvaluator.withDefaultDataSource(definition.getRefreshKey(), definition.getDataSource());
        return refreshKeyCache.value(refreshKey, refreshKeyEvaluator);
    }

    private TimeRange defaultRange(PreAggregationDefinition definition, ZoneId zone) {
        if (!definition.isPartitioned()) {
            return null;
        }
        Instant now = clock.instant();
        Duration retention = definition.getRetention();
        if (retention != null && !retention.isZero() && !retention.isNegative()) {
            return new TimeRange(now.minus(retention), now);
        }
        ZonedDateTime start = definition.getPartitionGranularity().truncate(now.atZone(zone));
        return new TimeRange(start.toInstant(), definition.getPartitionGranularity().next(start).toInstant());
    }

    private boolean isImmutable(PreAggregationDefinition definition, PartitionSpec spec, Instant now) {
        return definition.getUpdateWindow() != null
                && spec.getRange() != null
                && spec.getRange().endsBefore(now.minus(definition.getUpdateWindow()));
    }

    private boolean dropQuietly(QueryDriver driver, String qualifiedTableName) {
        try {
            driver.dropTable(qualifiedTableName);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to drop table {}, it will be retried on the next refresh", qualifiedTableName, e);
            return false;
        }
    }

    private void countBuild(String result) {
        Counter.builder("orchestrator.preagg.build")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    static String versionHash(PreAggregationDefinition definition, PartitionSpec spec, String freshnessToken) {
        TimeRange range = spec.getRange();
        String slot = range == null ? "" : range.getFrom() + "/" + range.getTo();
        return QueryFingerprint.shortHash(definition.getSql() + "|" + spec.getPartitionName() + "|" + slot + "|" + freshnessToken);
    }

    /**
     * True if the partition name belongs to this definition and its slot certainly ends
     * before {@code instant}, whatever zone it was planned in.
     */
    static boolean endsBefore(PreAggregationDefinition definition, String partitionName, Instant instant) {
        Instant start = PartitionPlanner.slotStart(definition, partitionName);
        return start != null && !start.plus(definition.getPartitionGranularity().getMaxLength()).isAfter(instant);
    }

    private static String partitionKey(String dataSource, String schema, String partitionName) {
        return dataSource + "|" + schema + "." + partitionName;
    }

    private static String listingKey(String dataSource, String schema) {
        return dataSource + "|" + schema;
    }

    private static final class TableListing {
        private final List<String> tables;
        private final Instant loadedAt;

        private TableListing(List<String> tables, Instant loadedAt) {
            this.tables = tables;
            this.loadedAt = loadedAt;
        }
    }
}

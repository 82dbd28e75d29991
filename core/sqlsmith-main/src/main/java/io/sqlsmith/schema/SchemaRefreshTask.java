/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sqlsmith.schema;

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.airlift.units.Duration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static io.airlift.concurrent.Threads.daemonThreadsNamed;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Re-reads the target schema on a fixed delay so that tables created while
 * the generator runs become visible. A failed refresh leaves the previously
 * loaded tables and indexes in place and is retried on the next tick.
 */
public class SchemaRefreshTask
{
    private static final Logger log = Logger.get(SchemaRefreshTask.class);

    private final SchemaCache schemaCache;
    private final String targetSchema;
    private final boolean enabled;
    private final Duration refreshInterval;

    private final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, daemonThreadsNamed("schema-refresh-%s"));

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicLong consecutiveFailures = new AtomicLong();

    @Inject
    public SchemaRefreshTask(SchemaCacheConfig config, SchemaCache schemaCache)
    {
        this.schemaCache = requireNonNull(schemaCache, "schemaCache is null");
        this.targetSchema = config.getTargetSchema();
        this.enabled = config.isRefreshEnabled();
        this.refreshInterval = config.getRefreshInterval();
    }

    @PostConstruct
    public void start()
    {
        if (!enabled || started.getAndSet(true)) {
            return;
        }
        log.info("Refreshing tables of schema %s every %s", targetSchema, refreshInterval);
        long delayMillis = refreshInterval.toMillis();
        executor.scheduleWithFixedDelay(this::refreshSchema, delayMillis, delayMillis, MILLISECONDS);
    }

    @PreDestroy
    public void shutdown()
    {
        executor.shutdownNow();
    }

    /**
     * Runs one refresh of the schema cache.
     *
     * @return whether the refresh succeeded
     */
    public boolean refreshSchema()
    {
        try {
            schemaCache.refresh();
        }
        catch (RuntimeException e) {
            // an exception escaping the scheduled runnable would cancel it
            long failures = consecutiveFailures.incrementAndGet();
            log.warn(e, "Failed to refresh schema %s (%s consecutive failures), keeping %s previously loaded tables",
                    targetSchema, failures, schemaCache.getTables().size());
            return false;
        }
        long failures = consecutiveFailures.getAndSet(0);
        if (failures > 0) {
            log.info("Schema %s refreshed after %s failed attempts", targetSchema, failures);
        }
        return true;
    }

    public boolean isStarted()
    {
        return started.get();
    }

    public long getConsecutiveFailures()
    {
        return consecutiveFailures.get();
    }
}

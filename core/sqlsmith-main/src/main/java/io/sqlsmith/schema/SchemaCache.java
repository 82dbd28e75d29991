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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.airlift.log.Logger;
import io.sqlsmith.metadata.IndexDefinition;
import io.sqlsmith.metadata.QualifiedTableName;
import io.sqlsmith.metadata.TableReference;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.result.ResultIterator;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static io.airlift.units.Duration.nanosSince;
import static java.util.Objects.requireNonNull;

/**
 * Current tables and indexes of the target schema.
 * <p>
 * {@link #refresh()} is the only mutator: it reloads everything under the
 * write lock and replaces the previous state only when the whole reload
 * succeeded. All lookups and random picks share the read lock.
 */
@ThreadSafe
public class SchemaCache
{
    private static final Logger log = Logger.get(SchemaCache.class);

    private final Optional<Jdbi> jdbi;
    private final IntrospectionDialect dialect;
    private final TableGrouper tableGrouper;
    private final IndexAssembler indexAssembler;
    private final Random random;

    private final ReadWriteLock schemaLock = new ReentrantReadWriteLock();
    private final Lock readLock = schemaLock.readLock();
    private final Lock writeLock = schemaLock.writeLock();

    @GuardedBy("schemaLock")
    private List<TableReference> tables = ImmutableList.of();
    @GuardedBy("schemaLock")
    private Map<QualifiedTableName, Map<String, IndexDefinition>> indexes = ImmutableMap.of();

    public SchemaCache(Optional<Jdbi> jdbi, IntrospectionDialect dialect, String targetSchema, Random random)
    {
        this.jdbi = requireNonNull(jdbi, "jdbi is null");
        this.dialect = requireNonNull(dialect, "dialect is null");
        this.tableGrouper = new TableGrouper(targetSchema);
        this.indexAssembler = new IndexAssembler(dialect);
        this.random = requireNonNull(random, "random is null");
    }

    /**
     * Creates a cache with no connection. Refreshing it does nothing and it never has tables.
     */
    public static SchemaCache schemaless(Random random)
    {
        return new SchemaCache(Optional.empty(), new CockroachIntrospectionDialect(), "public", random);
    }

    /**
     * Reloads all tables and indexes of the target schema. On failure the
     * exception propagates and the previous tables and indexes are kept.
     */
    public void refresh()
    {
        if (jdbi.isEmpty()) {
            return;
        }

        writeLock.lock();
        try {
            long start = System.nanoTime();
            SchemaSnapshot snapshot = jdbi.get().withHandle(this::loadSnapshot);
            tables = snapshot.tables();
            indexes = snapshot.indexes();
            log.info("Loaded %s tables and %s indexes from schema %s in %s",
                    tables.size(),
                    indexes.values().stream().mapToInt(Map::size).sum(),
                    tableGrouper.getTargetSchema(),
                    nanosSince(start).convertToMostSuccinctTimeUnit());
        }
        finally {
            writeLock.unlock();
        }
    }

    private SchemaSnapshot loadSnapshot(Handle handle)
    {
        List<TableReference> loadedTables;
        try (ResultIterator<ColumnRow> rows = dialect.createColumnsQuery(handle, tableGrouper.getTargetSchema())
                .map(new ColumnRowMapper())
                .iterator()) {
            loadedTables = tableGrouper.group(rows);
        }
        return new SchemaSnapshot(loadedTables, indexAssembler.loadIndexes(handle, loadedTables));
    }

    public List<TableReference> getTables()
    {
        readLock.lock();
        try {
            return tables;
        }
        finally {
            readLock.unlock();
        }
    }

    public Optional<TableReference> pickRandomTable()
    {
        readLock.lock();
        try {
            return randomTable();
        }
        finally {
            readLock.unlock();
        }
    }

    /**
     * Indexes of the table keyed by index name, or an empty map when the table has none or is unknown.
     */
    public Map<String, IndexDefinition> getIndexes(QualifiedTableName table)
    {
        requireNonNull(table, "table is null");
        readLock.lock();
        try {
            return indexes.getOrDefault(table, ImmutableMap.of());
        }
        finally {
            readLock.unlock();
        }
    }

    public IndexChoice pickRandomIndex()
    {
        readLock.lock();
        try {
            return randomTable()
                    .map(table -> randomIndexOn(table.name()))
                    .orElseGet(IndexChoice::noTables);
        }
        finally {
            readLock.unlock();
        }
    }

    public IndexChoice pickRandomIndexOn(QualifiedTableName table)
    {
        requireNonNull(table, "table is null");
        readLock.lock();
        try {
            return randomIndexOn(table);
        }
        finally {
            readLock.unlock();
        }
    }

    @GuardedBy("schemaLock")
    private Optional<TableReference> randomTable()
    {
        if (tables.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(tables.get(random.nextInt(tables.size())));
    }

    @GuardedBy("schemaLock")
    private IndexChoice randomIndexOn(QualifiedTableName table)
    {
        Map<String, IndexDefinition> tableIndexes = indexes.getOrDefault(table, ImmutableMap.of());
        if (tableIndexes.isEmpty()) {
            return IndexChoice.noIndexes(table);
        }
        List<IndexDefinition> candidates = ImmutableList.copyOf(tableIndexes.values());
        return IndexChoice.found(candidates.get(random.nextInt(candidates.size())));
    }

    private record SchemaSnapshot(List<TableReference> tables, Map<QualifiedTableName, Map<String, IndexDefinition>> indexes) {}
}

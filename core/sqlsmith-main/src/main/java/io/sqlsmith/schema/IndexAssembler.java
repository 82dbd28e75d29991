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

import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import io.sqlsmith.metadata.IndexDefinition;
import io.sqlsmith.metadata.QualifiedTableName;
import io.sqlsmith.metadata.SortOrder;
import io.sqlsmith.metadata.TableReference;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.result.ResultIterator;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static java.util.Objects.requireNonNull;

/**
 * Loads the indexes of every table, one query per table. The result is only
 * returned once all tables were loaded; any failure propagates and nothing
 * is returned.
 */
public class IndexAssembler
{
    private static final Logger log = Logger.get(IndexAssembler.class);

    private final IntrospectionDialect dialect;

    public IndexAssembler(IntrospectionDialect dialect)
    {
        this.dialect = requireNonNull(dialect, "dialect is null");
    }

    public Map<QualifiedTableName, Map<String, IndexDefinition>> loadIndexes(Handle handle, List<TableReference> tables)
    {
        ImmutableMap.Builder<QualifiedTableName, Map<String, IndexDefinition>> indexes = ImmutableMap.builder();
        for (TableReference table : tables) {
            Map<String, IndexDefinition> tableIndexes;
            try (ResultIterator<IndexRow> rows = dialect.createIndexesQuery(handle, table.name())
                    .map(new IndexRowMapper())
                    .iterator()) {
                tableIndexes = assemble(table.name(), rows);
            }
            log.debug("Loaded %s indexes for %s", tableIndexes.size(), table.name());
            indexes.put(table.name(), tableIndexes);
        }
        return indexes.buildOrThrow();
    }

    /**
     * Folds the index rows of one table into index definitions, keeping the
     * order in which indexes and key columns first appear.
     */
    public static Map<String, IndexDefinition> assemble(QualifiedTableName table, Iterator<IndexRow> rows)
    {
        requireNonNull(table, "table is null");
        Map<String, IndexDefinition.Builder> builders = new LinkedHashMap<>();
        while (rows.hasNext()) {
            IndexRow row = rows.next();
            IndexDefinition.Builder index = builders.computeIfAbsent(row.indexName(), name -> IndexDefinition.builder(name, table));
            if (row.storing()) {
                index.addStoringColumn(row.columnName());
            }
            else {
                index.addKeyColumn(row.columnName(), SortOrder.fromAscending(row.ascending()));
            }
        }
        return builders.entrySet().stream()
                .collect(toImmutableMap(Map.Entry::getKey, entry -> entry.getValue().build()));
    }
}

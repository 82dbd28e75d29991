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
import io.sqlsmith.metadata.ColumnDefinition;
import io.sqlsmith.metadata.QualifiedTableName;
import io.sqlsmith.metadata.TableReference;
import io.sqlsmith.type.SqlTypeNames;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Folds a stream of column rows, sorted by catalog, schema and table, into
 * one {@link TableReference} per table of the target schema.
 * <p>
 * Hidden columns are dropped before grouping, so a table whose columns are
 * all hidden produces no table at all. Rows of other schemas only delimit
 * groups; their type names are never resolved.
 */
public class TableGrouper
{
    private final String targetSchema;

    public TableGrouper(String targetSchema)
    {
        this.targetSchema = requireNonNull(targetSchema, "targetSchema is null");
    }

    public String getTargetSchema()
    {
        return targetSchema;
    }

    /**
     * @throws io.sqlsmith.spi.SqlsmithException if a column of the target schema has an unknown type name
     */
    public List<TableReference> group(Iterator<ColumnRow> rows)
    {
        ImmutableList.Builder<TableReference> tables = ImmutableList.builder();

        TableKey currentTable = null;
        List<ColumnDefinition> currentColumns = new ArrayList<>();
        while (rows.hasNext()) {
            ColumnRow row = rows.next();
            if (row.hidden()) {
                continue;
            }

            TableKey table = new TableKey(row.catalogName(), row.schemaName(), row.tableName());
            if (currentTable != null && !currentTable.equals(table)) {
                emit(tables, currentTable, currentColumns);
                currentColumns = new ArrayList<>();
            }
            currentTable = table;

            if (isTargetSchema(table)) {
                currentColumns.add(new ColumnDefinition(
                        row.columnName(),
                        SqlTypeNames.fromName(row.typeName()),
                        row.nullable(),
                        row.computed()));
            }
        }
        if (currentTable != null) {
            emit(tables, currentTable, currentColumns);
        }
        return tables.build();
    }

    private void emit(ImmutableList.Builder<TableReference> tables, TableKey table, List<ColumnDefinition> columns)
    {
        if (!isTargetSchema(table)) {
            return;
        }
        tables.add(new TableReference(new QualifiedTableName(table.catalogName(), table.schemaName(), table.tableName()), columns));
    }

    private boolean isTargetSchema(TableKey table)
    {
        return table.schemaName().equals(targetSchema);
    }

    private record TableKey(String catalogName, String schemaName, String tableName) {}
}

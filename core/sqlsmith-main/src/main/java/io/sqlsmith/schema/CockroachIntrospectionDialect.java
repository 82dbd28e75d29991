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

import io.sqlsmith.metadata.QualifiedTableName;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.Query;

import static java.lang.String.format;

public class CockroachIntrospectionDialect
        implements IntrospectionDialect
{
    private static final String COLUMNS_QUERY = """
            SELECT
                table_catalog,
                table_schema,
                table_name,
                column_name,
                crdb_sql_type,
                generation_expression != '' AS computed,
                is_nullable = 'YES' AS nullable,
                is_hidden = 'YES' AS hidden
            FROM
                information_schema.columns
            WHERE
                table_schema = :schema
            ORDER BY
                table_catalog, table_schema, table_name, ordinal_position
            """;

    private static final String INDEXES_QUERY = "SELECT index_name, column_name, storing, direction = 'ASC' FROM [SHOW INDEXES FROM %s]";

    @Override
    public Query createColumnsQuery(Handle handle, String schemaName)
    {
        return handle.createQuery(COLUMNS_QUERY)
                .bind("schema", schemaName);
    }

    @Override
    public Query createIndexesQuery(Handle handle, QualifiedTableName table)
    {
        return handle.createQuery(format(INDEXES_QUERY, table.getQuotedName()));
    }
}

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

/**
 * Metadata queries understood by the engine under test.
 */
public interface IntrospectionDialect
{
    /**
     * Column metadata in the shape read by {@link ColumnRowMapper}, ordered by
     * catalog, schema and table so that the columns of one table are contiguous.
     * Rows of other schemas may be returned and are ignored.
     */
    Query createColumnsQuery(Handle handle, String schemaName);

    /**
     * Index metadata of one table in the shape read by {@link IndexRowMapper},
     * with the key columns of each index in key order.
     */
    Query createIndexesQuery(Handle handle, QualifiedTableName table);
}

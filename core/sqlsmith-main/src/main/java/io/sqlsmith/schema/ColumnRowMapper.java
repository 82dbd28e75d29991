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

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

import static io.sqlsmith.schema.IntrospectionColumns.getRequiredBoolean;
import static io.sqlsmith.schema.IntrospectionColumns.getRequiredString;

/**
 * Maps the columns of the introspection query by position:
 * catalog, schema, table, column, type name, computed, nullable, hidden.
 */
public class ColumnRowMapper
        implements RowMapper<ColumnRow>
{
    @Override
    public ColumnRow map(ResultSet rs, StatementContext ctx)
            throws SQLException
    {
        return new ColumnRow(
                getRequiredString(rs, 1, "catalog"),
                getRequiredString(rs, 2, "schema"),
                getRequiredString(rs, 3, "table"),
                getRequiredString(rs, 4, "column"),
                getRequiredString(rs, 5, "type"),
                getRequiredBoolean(rs, 6, "computed"),
                getRequiredBoolean(rs, 7, "nullable"),
                getRequiredBoolean(rs, 8, "hidden"));
    }
}

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
 * Maps the columns of the per-table index query by position:
 * index name, column, storing, ascending.
 */
public class IndexRowMapper
        implements RowMapper<IndexRow>
{
    @Override
    public IndexRow map(ResultSet rs, StatementContext ctx)
            throws SQLException
    {
        return new IndexRow(
                getRequiredString(rs, 1, "index"),
                getRequiredString(rs, 2, "column"),
                getRequiredBoolean(rs, 3, "storing"),
                getRequiredBoolean(rs, 4, "ascending"));
    }
}

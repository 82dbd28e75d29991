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

import java.sql.ResultSet;
import java.sql.SQLException;

import static java.lang.String.format;

final class IntrospectionColumns
{
    private IntrospectionColumns() {}

    static String getRequiredString(ResultSet rs, int columnIndex, String description)
            throws SQLException
    {
        String value = rs.getString(columnIndex);
        if (value == null) {
            throw new SQLException(format("Introspection column %s (%s) is null", columnIndex, description));
        }
        return value;
    }

    static boolean getRequiredBoolean(ResultSet rs, int columnIndex, String description)
            throws SQLException
    {
        boolean value = rs.getBoolean(columnIndex);
        if (rs.wasNull()) {
            throw new SQLException(format("Introspection column %s (%s) is null", columnIndex, description));
        }
        return value;
    }
}

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
package io.sqlsmith.metadata;

import io.sqlsmith.spi.type.SqlType;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record ColumnDefinition(String name, SqlType type, boolean nullable, boolean computed)
{
    public ColumnDefinition
    {
        requireNonNull(name, "name is null");
        checkArgument(!name.isEmpty(), "name is empty");
        requireNonNull(type, "type is null");
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder()
                .append(name)
                .append(' ')
                .append(type);
        if (!nullable) {
            builder.append(" NOT NULL");
        }
        if (computed) {
            builder.append(" AS (...) STORED");
        }
        return builder.toString();
    }
}

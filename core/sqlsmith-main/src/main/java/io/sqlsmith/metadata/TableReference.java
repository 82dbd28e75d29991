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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A table discovered in the target schema with its visible columns in declaration order.
 */
public record TableReference(QualifiedTableName name, List<ColumnDefinition> columns)
{
    public TableReference
    {
        requireNonNull(name, "name is null");
        columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
    }

    public Optional<ColumnDefinition> getColumn(String columnName)
    {
        return columns.stream()
                .filter(column -> column.name().equals(columnName))
                .findFirst();
    }
}

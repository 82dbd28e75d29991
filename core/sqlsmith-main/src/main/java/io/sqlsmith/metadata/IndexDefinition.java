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

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One index of a table. Key columns keep their position in the index key;
 * storing columns are carried in the index payload only.
 */
public record IndexDefinition(String name, QualifiedTableName table, List<IndexColumn> keyColumns, List<String> storingColumns)
{
    public IndexDefinition
    {
        requireNonNull(name, "name is null");
        checkArgument(!name.isEmpty(), "name is empty");
        requireNonNull(table, "table is null");
        keyColumns = ImmutableList.copyOf(requireNonNull(keyColumns, "keyColumns is null"));
        storingColumns = ImmutableList.copyOf(requireNonNull(storingColumns, "storingColumns is null"));
    }

    public static Builder builder(String name, QualifiedTableName table)
    {
        return new Builder(name, table);
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder()
                .append(name)
                .append(" ON ")
                .append(table)
                .append(' ')
                .append(keyColumns);
        if (!storingColumns.isEmpty()) {
            builder.append(" STORING ").append(storingColumns);
        }
        return builder.toString();
    }

    public static final class Builder
    {
        private final String name;
        private final QualifiedTableName table;
        private final List<IndexColumn> keyColumns = new ArrayList<>();
        private final List<String> storingColumns = new ArrayList<>();

        private Builder(String name, QualifiedTableName table)
        {
            this.name = requireNonNull(name, "name is null");
            this.table = requireNonNull(table, "table is null");
        }

        public Builder addKeyColumn(String column, SortOrder sortOrder)
        {
            keyColumns.add(new IndexColumn(column, sortOrder));
            return this;
        }

        public Builder addStoringColumn(String column)
        {
            storingColumns.add(requireNonNull(column, "column is null"));
            return this;
        }

        public IndexDefinition build()
        {
            return new IndexDefinition(name, table, keyColumns, storingColumns);
        }
    }
}

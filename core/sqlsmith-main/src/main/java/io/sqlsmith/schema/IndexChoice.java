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

import io.sqlsmith.metadata.IndexDefinition;
import io.sqlsmith.metadata.QualifiedTableName;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Outcome of a random index pick. Callers that get {@link Outcome#NO_INDEXES}
 * may retry against another table; {@link Outcome#NO_TABLES} means the schema is empty.
 */
public record IndexChoice(Outcome outcome, Optional<QualifiedTableName> table, Optional<IndexDefinition> index)
{
    public enum Outcome
    {
        FOUND,
        NO_TABLES,
        NO_INDEXES,
    }

    public IndexChoice
    {
        requireNonNull(outcome, "outcome is null");
        requireNonNull(table, "table is null");
        requireNonNull(index, "index is null");
        checkArgument(index.isPresent() == (outcome == Outcome.FOUND), "index must be present only when found");
        checkArgument(table.isEmpty() == (outcome == Outcome.NO_TABLES), "table must be absent only when there are no tables");
    }

    public static IndexChoice found(IndexDefinition index)
    {
        return new IndexChoice(Outcome.FOUND, Optional.of(index.table()), Optional.of(index));
    }

    public static IndexChoice noTables()
    {
        return new IndexChoice(Outcome.NO_TABLES, Optional.empty(), Optional.empty());
    }

    public static IndexChoice noIndexes(QualifiedTableName table)
    {
        return new IndexChoice(Outcome.NO_INDEXES, Optional.of(table), Optional.empty());
    }

    public boolean isFound()
    {
        return outcome == Outcome.FOUND;
    }

    public IndexDefinition getIndex()
    {
        checkState(isFound(), "no index was chosen: %s", outcome);
        return index.get();
    }

    public String getIndexName()
    {
        return getIndex().name();
    }
}

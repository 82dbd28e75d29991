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
import io.sqlsmith.metadata.IndexColumn;
import io.sqlsmith.metadata.IndexDefinition;
import io.sqlsmith.metadata.QualifiedTableName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.sqlsmith.metadata.SortOrder.ASCENDING;
import static io.sqlsmith.metadata.SortOrder.DESCENDING;
import static io.sqlsmith.schema.IndexAssembler.assemble;
import static org.assertj.core.api.Assertions.assertThat;

class TestIndexAssembler
{
    private static final QualifiedTableName TABLE = new QualifiedTableName("defaultdb", "public", "t1");

    @Test
    void testKeyAndStoringColumns()
    {
        Map<String, IndexDefinition> indexes = assemble(TABLE, ImmutableList.of(
                new IndexRow("idx1", "a", false, true),
                new IndexRow("idx1", "b", true, false)).iterator());

        assertThat(indexes).containsOnlyKeys("idx1");
        IndexDefinition index = indexes.get("idx1");
        assertThat(index.name()).isEqualTo("idx1");
        assertThat(index.table()).isEqualTo(TABLE);
        assertThat(index.keyColumns()).containsExactly(new IndexColumn("a", ASCENDING));
        assertThat(index.storingColumns()).containsExactly("b");
    }

    @Test
    void testMultipleIndexesKeepArrivalOrder()
    {
        Map<String, IndexDefinition> indexes = assemble(TABLE, ImmutableList.of(
                new IndexRow("t1_pkey", "id", false, true),
                new IndexRow("by_name", "last_name", false, true),
                new IndexRow("by_name", "first_name", false, false),
                new IndexRow("t1_pkey", "last_name", true, true),
                new IndexRow("by_name", "id", true, true)).iterator());

        assertThat(indexes.keySet()).containsExactly("t1_pkey", "by_name");
        assertThat(indexes.get("t1_pkey").keyColumns()).containsExactly(new IndexColumn("id", ASCENDING));
        assertThat(indexes.get("t1_pkey").storingColumns()).containsExactly("last_name");
        assertThat(indexes.get("by_name").keyColumns()).containsExactly(
                new IndexColumn("last_name", ASCENDING),
                new IndexColumn("first_name", DESCENDING));
        assertThat(indexes.get("by_name").storingColumns()).containsExactly("id");
    }

    @Test
    void testNoRows()
    {
        assertThat(assemble(TABLE, ImmutableList.<IndexRow>of().iterator())).isEmpty();
    }
}

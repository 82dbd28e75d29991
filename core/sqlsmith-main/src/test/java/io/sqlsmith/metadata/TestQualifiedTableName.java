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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TestQualifiedTableName
{
    @Test
    void testValueOf()
    {
        QualifiedTableName name = QualifiedTableName.valueOf("defaultdb.public.orders");
        assertThat(name).isEqualTo(new QualifiedTableName("defaultdb", "public", "orders"));
        assertThat(name.getCatalogName()).isEqualTo("defaultdb");
        assertThat(name.getSchemaName()).isEqualTo("public");
        assertThat(name.getTableName()).isEqualTo("orders");
        assertThat(name).hasToString("defaultdb.public.orders");

        assertThatThrownBy(() -> QualifiedTableName.valueOf("public.orders"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid name public.orders");
    }

    @Test
    void testQuotedName()
    {
        assertThat(new QualifiedTableName("defaultdb", "public", "orders").getQuotedName())
                .isEqualTo("\"defaultdb\".\"public\".\"orders\"");
        assertThat(new QualifiedTableName("defaultdb", "public", "Order \"Lines\"").getQuotedName())
                .isEqualTo("\"defaultdb\".\"public\".\"Order \"\"Lines\"\"\"");
    }
}

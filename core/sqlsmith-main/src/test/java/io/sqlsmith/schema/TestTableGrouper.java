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
import io.sqlsmith.metadata.ColumnDefinition;
import io.sqlsmith.metadata.QualifiedTableName;
import io.sqlsmith.metadata.TableReference;
import io.sqlsmith.spi.SqlsmithException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.sqlsmith.spi.type.StandardTypes.BIT;
import static io.sqlsmith.spi.type.StandardTypes.BOOL;
import static io.sqlsmith.spi.type.StandardTypes.INT4;
import static io.sqlsmith.spi.type.StandardTypes.INT8;
import static io.sqlsmith.spi.type.StandardTypes.STRING;
import static io.sqlsmith.spi.type.StandardTypes.UNKNOWN;
import static io.sqlsmith.spi.type.StandardTypes.VARBIT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TestTableGrouper
{
    private final TableGrouper grouper = new TableGrouper("public");

    @Test
    void testGroupsConsecutiveRowsByTable()
    {
        List<TableReference> tables = group(
                column("public", "t1", "col_a", "INT4", true),
                column("public", "t1", "col_b", "TEXT", false),
                column("public", "t2", "col_c", "BOOL", true));

        assertThat(tables).containsExactly(
                new TableReference(table("t1"), ImmutableList.of(
                        new ColumnDefinition("col_a", INT4, true, false),
                        new ColumnDefinition("col_b", STRING, false, false))),
                new TableReference(table("t2"), ImmutableList.of(
                        new ColumnDefinition("col_c", BOOL, true, false))));
    }

    @Test
    void testEmptyInput()
    {
        assertThat(group()).isEmpty();
    }

    @Test
    void testFinalTableIsFlushed()
    {
        List<TableReference> tables = group(column("public", "only", "id", "INT8", false));

        assertThat(tables).hasSize(1);
        assertThat(tables.get(0).name()).isEqualTo(table("only"));
        assertThat(tables.get(0).columns()).extracting(ColumnDefinition::name).containsExactly("id");
    }

    @Test
    void testOtherSchemasAreSkipped()
    {
        List<TableReference> tables = group(
                column("information_schema", "columns", "table_name", "STRING", true),
                column("public", "t1", "id", "INT8", false),
                column("pg_catalog", "pg_class", "oid", "OID", false),
                column("pg_catalog", "pg_class", "relname", "STRING", false),
                column("public", "t2", "id", "INT8", false));

        assertThat(tables).extracting(TableReference::name).containsExactly(table("t1"), table("t2"));
    }

    @Test
    void testOtherSchemasDoNotResolveTypes()
    {
        List<TableReference> tables = group(
                column("crdb_internal", "zones", "config", "MOOD", true),
                column("public", "t1", "id", "INT8", false));

        assertThat(tables).extracting(TableReference::name).containsExactly(table("t1"));
    }

    @Test
    void testHiddenColumnsAreSkipped()
    {
        List<TableReference> tables = group(
                hiddenColumn("public", "t1", "rowid"),
                column("public", "t1", "a", "INT8", true),
                hiddenColumn("public", "t1", "crdb_internal_a_shard"),
                column("public", "t1", "b", "STRING", true));

        assertThat(tables).hasSize(1);
        assertThat(tables.get(0).columns()).extracting(ColumnDefinition::name).containsExactly("a", "b");
    }

    @Test
    void testTableWithOnlyHiddenColumnsIsDropped()
    {
        List<TableReference> tables = group(
                column("public", "t1", "a", "INT8", true),
                hiddenColumn("public", "t2", "rowid"),
                column("public", "t3", "b", "INT8", true));

        assertThat(tables).extracting(TableReference::name).containsExactly(table("t1"), table("t3"));
    }

    @Test
    void testSameTableNameInDifferentCatalogs()
    {
        List<TableReference> tables = group(
                new ColumnRow("db1", "public", "t", "a", "INT8", false, true, false),
                new ColumnRow("db2", "public", "t", "a", "INT8", false, true, false));

        assertThat(tables).extracting(TableReference::name).containsExactly(
                new QualifiedTableName("db1", "public", "t"),
                new QualifiedTableName("db2", "public", "t"));
    }

    @Test
    void testComputedColumn()
    {
        List<TableReference> tables = group(
                column("public", "t1", "a", "INT8", true),
                new ColumnRow("defaultdb", "public", "t1", "a_doubled", "INT8", true, true, false));

        assertThat(tables.get(0).getColumn("a_doubled"))
                .contains(new ColumnDefinition("a_doubled", INT8, true, true));
        assertThat(tables.get(0).getColumn("missing")).isEmpty();
    }

    @Test
    void testUnknownTypeFails()
    {
        assertThatThrownBy(() -> group(column("public", "t1", "feeling", "MOOD", true)))
                .isInstanceOf(SqlsmithException.class)
                .hasMessage("Unknown type name: MOOD");
    }

    @Test
    void testCollatedAndBitColumns()
    {
        List<TableReference> tables = group(
                column("public", "t1", "label", "STRING COLLATE en", true),
                column("public", "t1", "flag", "BIT(1)", false),
                column("public", "t1", "mask", "VARBIT", true),
                column("public", "t1", "shape", "GEOMETRY", true));

        assertThat(tables).hasSize(1);
        assertThat(tables.get(0).columns()).containsExactly(
                new ColumnDefinition("label", STRING, true, false),
                new ColumnDefinition("flag", BIT, false, false),
                new ColumnDefinition("mask", VARBIT, true, false),
                new ColumnDefinition("shape", UNKNOWN, true, false));
    }

    private List<TableReference> group(ColumnRow... rows)
    {
        return grouper.group(ImmutableList.copyOf(rows).iterator());
    }

    private static ColumnRow column(String schema, String table, String column, String type, boolean nullable)
    {
        return new ColumnRow("defaultdb", schema, table, column, type, false, nullable, false);
    }

    private static ColumnRow hiddenColumn(String schema, String table, String column)
    {
        return new ColumnRow("defaultdb", schema, table, column, "INT8", false, false, true);
    }

    private static QualifiedTableName table(String name)
    {
        return new QualifiedTableName("defaultdb", "public", name);
    }
}

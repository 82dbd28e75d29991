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
package io.sqlsmith.catalog;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.sqlsmith.builtin.BuiltinSignatureRegistry;
import io.sqlsmith.spi.function.BinaryOperator;
import io.sqlsmith.spi.function.BinaryOperatorOverload;
import io.sqlsmith.spi.function.FunctionDefinition;
import io.sqlsmith.spi.function.SignatureRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.sqlsmith.spi.function.BinaryOperator.CONCAT;
import static io.sqlsmith.spi.function.BinaryOperator.JSON_FETCH_TEXT;
import static io.sqlsmith.spi.function.BinaryOperator.MINUS;
import static io.sqlsmith.spi.function.BinaryOperator.PLUS;
import static io.sqlsmith.spi.type.StandardTypes.DATE;
import static io.sqlsmith.spi.type.StandardTypes.DECIMAL;
import static io.sqlsmith.spi.type.StandardTypes.INT8;
import static io.sqlsmith.spi.type.StandardTypes.INT8_ARRAY;
import static io.sqlsmith.spi.type.StandardTypes.STRING;
import static io.sqlsmith.spi.type.StandardTypes.UUID;
import static org.assertj.core.api.Assertions.assertThat;

class TestOperatorCatalog
{
    @Test
    void testEntriesKeyedByReturnType()
    {
        OperatorCatalog catalog = OperatorCatalog.build(registry(ImmutableMap.of(
                PLUS, ImmutableList.of(
                        new BinaryOperatorOverload(INT8, INT8, INT8),
                        new BinaryOperatorOverload(DECIMAL, INT8, DECIMAL)),
                MINUS, ImmutableList.of(
                        new BinaryOperatorOverload(DATE, DATE, INT8)),
                CONCAT, ImmutableList.of(
                        new BinaryOperatorOverload(INT8_ARRAY, INT8, INT8_ARRAY)))));

        assertThat(catalog.size()).isEqualTo(4);
        assertThat(catalog.getReturnTypes()).containsExactlyInAnyOrder(INT8.getTypeId(), DECIMAL.getTypeId(), INT8_ARRAY.getTypeId());
        assertThat(catalog.getOperators(INT8.getTypeId())).containsExactly(
                new OperatorEntry(PLUS, new BinaryOperatorOverload(INT8, INT8, INT8)),
                new OperatorEntry(MINUS, new BinaryOperatorOverload(DATE, DATE, INT8)));
        assertThat(catalog.getOperators(DECIMAL.getTypeId())).extracting(OperatorEntry::operator).containsExactly(PLUS);
        // array results are kept
        assertThat(catalog.getOperators(INT8_ARRAY.getTypeId())).extracting(OperatorEntry::operator).containsExactly(CONCAT);
        assertThat(catalog.getOperators(UUID.getTypeId())).isEmpty();
    }

    @Test
    void testEmptyRegistry()
    {
        OperatorCatalog catalog = OperatorCatalog.build(registry(ImmutableMap.of()));
        assertThat(catalog.size()).isZero();
        assertThat(catalog.getOperatorsByReturnType()).isEmpty();
    }

    @Test
    void testBuiltinRegistry()
    {
        SignatureRegistry registry = new BuiltinSignatureRegistry();
        OperatorCatalog catalog = OperatorCatalog.build(registry);

        int overloads = registry.getBinaryOperators().values().stream().mapToInt(List::size).sum();
        assertThat(catalog.size()).isEqualTo(overloads);
        assertThat(catalog.getAllOperators()).hasSize(overloads);
        assertThat(catalog.getOperators(STRING.getTypeId()))
                .extracting(OperatorEntry::operator)
                .contains(CONCAT, JSON_FETCH_TEXT);
        assertThat(catalog.getOperatorsByReturnType()).allSatisfy((typeId, entries) ->
                assertThat(entries).allMatch(entry -> entry.overload().returnType().getTypeId().equals(typeId)));

        OperatorCatalog rebuilt = OperatorCatalog.build(new BuiltinSignatureRegistry());
        assertThat(rebuilt.getOperatorsByReturnType()).isEqualTo(catalog.getOperatorsByReturnType());
    }

    private static SignatureRegistry registry(Map<BinaryOperator, List<BinaryOperatorOverload>> operators)
    {
        return new SignatureRegistry()
        {
            @Override
            public Map<BinaryOperator, List<BinaryOperatorOverload>> getBinaryOperators()
            {
                return operators;
            }

            @Override
            public List<FunctionDefinition> getFunctions()
            {
                return ImmutableList.of();
            }
        };
    }
}

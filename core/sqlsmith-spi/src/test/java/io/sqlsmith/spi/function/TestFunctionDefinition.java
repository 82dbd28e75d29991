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
package io.sqlsmith.spi.function;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static io.sqlsmith.spi.type.StandardTypes.FLOAT8;
import static io.sqlsmith.spi.type.StandardTypes.INT8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TestFunctionDefinition
{
    @Test
    void testDefinition()
    {
        FunctionOverload overload = new FunctionOverload(ImmutableList.of(INT8), INT8, "Calculates the absolute value of `val`.");
        FunctionDefinition definition = new FunctionDefinition("abs", FunctionKind.SCALAR, "Math and numeric", false, ImmutableList.of(overload));

        assertThat(definition.getName()).isEqualTo("abs");
        assertThat(definition.getKind()).isEqualTo(FunctionKind.SCALAR);
        assertThat(definition.isPrivate()).isFalse();
        assertThat(definition.getOverloads()).containsExactly(overload);
        assertThat(overload.isDeterministic()).isTrue();
        assertThat(overload.isNullOnNullInput()).isTrue();
    }

    @Test
    void testVolatileOverload()
    {
        FunctionOverload overload = new FunctionOverload(ImmutableList.of(), FLOAT8, "Returns a random float between 0 and 1.", false, false);
        assertThat(overload.getArgumentTypes()).isEmpty();
        assertThat(overload.getFixedReturnType()).isEqualTo(FLOAT8);
        assertThat(overload.isDeterministic()).isFalse();
    }

    @Test
    void testNoOverloads()
    {
        assertThatThrownBy(() -> new FunctionDefinition("abs", FunctionKind.SCALAR, "Math and numeric", false, ImmutableList.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("function abs has no overloads");
    }
}

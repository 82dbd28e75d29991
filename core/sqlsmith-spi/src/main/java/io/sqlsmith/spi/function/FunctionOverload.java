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
import io.sqlsmith.spi.type.SqlType;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public final class FunctionOverload
{
    private final List<SqlType> argumentTypes;
    private final SqlType returnType;
    private final String info;
    private final boolean deterministic;
    private final boolean nullOnNullInput;

    public FunctionOverload(List<SqlType> argumentTypes, SqlType returnType, String info)
    {
        this(argumentTypes, returnType, info, true, true);
    }

    public FunctionOverload(List<SqlType> argumentTypes, SqlType returnType, String info, boolean deterministic, boolean nullOnNullInput)
    {
        this.argumentTypes = ImmutableList.copyOf(requireNonNull(argumentTypes, "argumentTypes is null"));
        this.returnType = requireNonNull(returnType, "returnType is null");
        this.info = requireNonNull(info, "info is null");
        this.deterministic = deterministic;
        this.nullOnNullInput = nullOnNullInput;
    }

    public List<SqlType> getArgumentTypes()
    {
        return argumentTypes;
    }

    /**
     * The return type of this overload when it does not depend on the
     * argument types. Polymorphic overloads report {@code ANY}.
     */
    public SqlType getFixedReturnType()
    {
        return returnType;
    }

    /**
     * Documentation shown to users for this overload.
     */
    public String getInfo()
    {
        return info;
    }

    public boolean isDeterministic()
    {
        return deterministic;
    }

    public boolean isNullOnNullInput()
    {
        return nullOnNullInput;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionOverload that = (FunctionOverload) o;
        return deterministic == that.deterministic &&
                nullOnNullInput == that.nullOnNullInput &&
                argumentTypes.equals(that.argumentTypes) &&
                returnType.equals(that.returnType) &&
                info.equals(that.info);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(argumentTypes, returnType, info, deterministic, nullOnNullInput);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("argumentTypes", argumentTypes)
                .add("returnType", returnType)
                .toString();
    }
}

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

import io.sqlsmith.spi.type.SqlType;

import static java.util.Objects.requireNonNull;

/**
 * One concrete signature of an infix operator: {@code leftType op rightType -> returnType}.
 */
public record BinaryOperatorOverload(SqlType leftType, SqlType rightType, SqlType returnType)
{
    public BinaryOperatorOverload
    {
        requireNonNull(leftType, "leftType is null");
        requireNonNull(rightType, "rightType is null");
        requireNonNull(returnType, "returnType is null");
    }

    @Override
    public String toString()
    {
        return "(" + leftType + ", " + rightType + "):" + returnType;
    }
}

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
package io.sqlsmith.spi.type;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

public final class SqlType
{
    private final String name;
    private final TypeId typeId;
    private final TypeFamily family;
    private final Optional<SqlType> elementType;

    private SqlType(String name, TypeId typeId, TypeFamily family, Optional<SqlType> elementType)
    {
        this.name = requireNonNull(name, "name is null");
        checkArgument(!name.isEmpty(), "name is empty");
        this.typeId = requireNonNull(typeId, "typeId is null");
        this.family = requireNonNull(family, "family is null");
        this.elementType = requireNonNull(elementType, "elementType is null");
        checkArgument(elementType.isPresent() == (family == TypeFamily.ARRAY), "only array types have an element type: %s", name);
    }

    public static SqlType createType(String name, int oid, TypeFamily family)
    {
        checkArgument(family != TypeFamily.ARRAY, "use createArrayType for arrays");
        return new SqlType(name.toUpperCase(ENGLISH), TypeId.of(oid), family, Optional.empty());
    }

    public static SqlType createArrayType(SqlType elementType, int oid)
    {
        requireNonNull(elementType, "elementType is null");
        checkArgument(!elementType.isArray(), "nested arrays are not supported: %s", elementType);
        return new SqlType(elementType.getName() + "[]", TypeId.of(oid), TypeFamily.ARRAY, Optional.of(elementType));
    }

    public String getName()
    {
        return name;
    }

    public TypeId getTypeId()
    {
        return typeId;
    }

    public TypeFamily getFamily()
    {
        return family;
    }

    public Optional<SqlType> getElementType()
    {
        return elementType;
    }

    public boolean isArray()
    {
        return family == TypeFamily.ARRAY;
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
        SqlType that = (SqlType) o;
        return typeId.equals(that.typeId) &&
                name.equals(that.name) &&
                family == that.family &&
                elementType.equals(that.elementType);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, typeId, family, elementType);
    }

    @Override
    public String toString()
    {
        return name;
    }
}

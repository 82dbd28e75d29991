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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Wire identifier (object id) of a type. Operators and functions are
 * catalogued by the id of the type they return.
 */
public record TypeId(int oid)
{
    public TypeId
    {
        checkArgument(oid > 0, "oid must be positive: %s", oid);
    }

    public static TypeId of(int oid)
    {
        return new TypeId(oid);
    }

    @Override
    public String toString()
    {
        return String.valueOf(oid);
    }
}

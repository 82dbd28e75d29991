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

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A named callable together with all of its overloads.
 */
public final class FunctionDefinition
{
    public static final String COMPATIBILITY_CATEGORY = "Compatibility";

    private final String name;
    private final FunctionKind kind;
    private final String category;
    private final boolean privateFunction;
    private final List<FunctionOverload> overloads;

    public FunctionDefinition(String name, FunctionKind kind, String category, boolean privateFunction, List<FunctionOverload> overloads)
    {
        this.name = requireNonNull(name, "name is null");
        checkArgument(!name.isEmpty(), "name is empty");
        this.kind = requireNonNull(kind, "kind is null");
        this.category = requireNonNull(category, "category is null");
        this.privateFunction = privateFunction;
        this.overloads = ImmutableList.copyOf(requireNonNull(overloads, "overloads is null"));
        checkArgument(!this.overloads.isEmpty(), "function %s has no overloads", name);
    }

    public String getName()
    {
        return name;
    }

    /**
     * The function class: scalar, aggregate, window or generator.
     */
    public FunctionKind getKind()
    {
        return kind;
    }

    public String getCategory()
    {
        return category;
    }

    /**
     * Private functions exist for internal use and are not exposed to users.
     */
    public boolean isPrivate()
    {
        return privateFunction;
    }

    public List<FunctionOverload> getOverloads()
    {
        return overloads;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("kind", kind)
                .add("category", category)
                .add("private", privateFunction)
                .add("overloads", overloads.size())
                .toString();
    }
}

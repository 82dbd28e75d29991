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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import io.sqlsmith.spi.function.BinaryOperator;
import io.sqlsmith.spi.function.BinaryOperatorOverload;
import io.sqlsmith.spi.function.SignatureRegistry;
import io.sqlsmith.spi.type.TypeId;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Every binary operator overload of the registry, keyed by the id of the type it returns.
 * Immutable once built.
 */
public final class OperatorCatalog
{
    private final ImmutableListMultimap<TypeId, OperatorEntry> operators;

    private OperatorCatalog(ListMultimap<TypeId, OperatorEntry> operators)
    {
        this.operators = ImmutableListMultimap.copyOf(operators);
    }

    public static OperatorCatalog build(SignatureRegistry registry)
    {
        requireNonNull(registry, "registry is null");
        ImmutableListMultimap.Builder<TypeId, OperatorEntry> operators = ImmutableListMultimap.builder();
        for (Map.Entry<BinaryOperator, List<BinaryOperatorOverload>> entry : registry.getBinaryOperators().entrySet()) {
            for (BinaryOperatorOverload overload : entry.getValue()) {
                operators.put(overload.returnType().getTypeId(), new OperatorEntry(entry.getKey(), overload));
            }
        }
        return new OperatorCatalog(operators.build());
    }

    public List<OperatorEntry> getOperators(TypeId returnType)
    {
        return operators.get(requireNonNull(returnType, "returnType is null"));
    }

    public Map<TypeId, Collection<OperatorEntry>> getOperatorsByReturnType()
    {
        return operators.asMap();
    }

    public Set<TypeId> getReturnTypes()
    {
        return operators.keySet();
    }

    public List<OperatorEntry> getAllOperators()
    {
        return ImmutableList.copyOf(operators.values());
    }

    public int size()
    {
        return operators.size();
    }
}

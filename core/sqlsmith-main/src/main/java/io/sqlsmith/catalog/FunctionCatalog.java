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
import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import io.sqlsmith.spi.function.FunctionDefinition;
import io.sqlsmith.spi.function.FunctionKind;
import io.sqlsmith.spi.function.FunctionOverload;
import io.sqlsmith.spi.function.SignatureRegistry;
import io.sqlsmith.spi.type.SqlType;
import io.sqlsmith.spi.type.StandardTypes;
import io.sqlsmith.spi.type.TypeId;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static io.sqlsmith.spi.function.FunctionDefinition.COMPATIBILITY_CATEGORY;
import static java.util.Objects.requireNonNull;

/**
 * Functions usable in generated expressions, keyed by function kind and the
 * id of the type they return. Immutable once built.
 * <p>
 * Excluded from the catalog:
 * <ul>
 * <li>{@code pg_sleep} and the {@code crdb_internal.force_*} functions, which stall or crash the server</li>
 * <li>functions of the {@code Compatibility} category, many of which are unimplemented</li>
 * <li>private functions</li>
 * <li>overloads documented as not usable</li>
 * <li>overloads whose return type is an array, tuple or pseudo type</li>
 * </ul>
 */
public final class FunctionCatalog
{
    private static final Logger log = Logger.get(FunctionCatalog.class);

    private static final String SLEEP_FUNCTION = "pg_sleep";
    private static final String FORCE_FUNCTION_MARKER = "crdb_internal.force_";
    private static final String NOT_USABLE_MARKER = "Not usable";

    private final Map<FunctionKind, ImmutableListMultimap<TypeId, FunctionEntry>> functions;

    private FunctionCatalog(Map<FunctionKind, ImmutableListMultimap<TypeId, FunctionEntry>> functions)
    {
        this.functions = ImmutableMap.copyOf(functions);
    }

    public static FunctionCatalog build(SignatureRegistry registry)
    {
        requireNonNull(registry, "registry is null");
        Map<FunctionKind, ImmutableListMultimap.Builder<TypeId, FunctionEntry>> builders = new EnumMap<>(FunctionKind.class);
        int skippedDefinitions = 0;
        int skippedOverloads = 0;
        for (FunctionDefinition definition : registry.getFunctions()) {
            if (!isGeneratable(definition)) {
                skippedDefinitions++;
                continue;
            }
            ImmutableListMultimap.Builder<TypeId, FunctionEntry> builder = builders.computeIfAbsent(definition.getKind(), kind -> ImmutableListMultimap.builder());
            for (FunctionOverload overload : definition.getOverloads()) {
                if (!isGeneratable(overload)) {
                    skippedOverloads++;
                    continue;
                }
                builder.put(overload.getFixedReturnType().getTypeId(), new FunctionEntry(definition, overload));
            }
        }
        log.debug("Skipped %s function definitions and %s overloads", skippedDefinitions, skippedOverloads);

        return new FunctionCatalog(builders.entrySet().stream()
                .collect(toImmutableMap(Map.Entry::getKey, entry -> entry.getValue().build())));
    }

    static boolean isGeneratable(FunctionDefinition definition)
    {
        String name = definition.getName();
        if (name.equals(SLEEP_FUNCTION) || name.contains(FORCE_FUNCTION_MARKER)) {
            return false;
        }
        if (definition.getCategory().equals(COMPATIBILITY_CATEGORY)) {
            return false;
        }
        return !definition.isPrivate();
    }

    static boolean isGeneratable(FunctionOverload overload)
    {
        if (overload.getInfo().contains(NOT_USABLE_MARKER)) {
            return false;
        }
        SqlType returnType = overload.getFixedReturnType();
        return StandardTypes.isNonArrayFamily(returnType.getFamily());
    }

    public List<FunctionEntry> getFunctions(FunctionKind kind, TypeId returnType)
    {
        requireNonNull(kind, "kind is null");
        requireNonNull(returnType, "returnType is null");
        ImmutableListMultimap<TypeId, FunctionEntry> byReturnType = functions.get(kind);
        if (byReturnType == null) {
            return ImmutableList.of();
        }
        return byReturnType.get(returnType);
    }

    public Map<FunctionKind, Map<TypeId, Collection<FunctionEntry>>> getFunctionsByKindAndReturnType()
    {
        ImmutableMap.Builder<FunctionKind, Map<TypeId, Collection<FunctionEntry>>> result = ImmutableMap.builder();
        functions.forEach((kind, byReturnType) -> result.put(kind, byReturnType.asMap()));
        return result.buildOrThrow();
    }

    public int size()
    {
        return functions.values().stream()
                .mapToInt(ImmutableListMultimap::size)
                .sum();
    }
}

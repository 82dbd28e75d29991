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
package io.sqlsmith.type;

import com.google.common.collect.ImmutableMap;
import io.sqlsmith.spi.SqlsmithException;
import io.sqlsmith.spi.type.SqlType;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static io.sqlsmith.spi.StandardErrorCode.TYPE_NOT_FOUND;
import static io.sqlsmith.spi.type.StandardTypes.ALL_TYPES;
import static io.sqlsmith.spi.type.StandardTypes.BIT;
import static io.sqlsmith.spi.type.StandardTypes.BOOL;
import static io.sqlsmith.spi.type.StandardTypes.BYTES;
import static io.sqlsmith.spi.type.StandardTypes.CHAR;
import static io.sqlsmith.spi.type.StandardTypes.DATE;
import static io.sqlsmith.spi.type.StandardTypes.DECIMAL;
import static io.sqlsmith.spi.type.StandardTypes.FLOAT4;
import static io.sqlsmith.spi.type.StandardTypes.FLOAT8;
import static io.sqlsmith.spi.type.StandardTypes.INET;
import static io.sqlsmith.spi.type.StandardTypes.INT2;
import static io.sqlsmith.spi.type.StandardTypes.INT4;
import static io.sqlsmith.spi.type.StandardTypes.INT8;
import static io.sqlsmith.spi.type.StandardTypes.INTERVAL;
import static io.sqlsmith.spi.type.StandardTypes.JSONB;
import static io.sqlsmith.spi.type.StandardTypes.NAME;
import static io.sqlsmith.spi.type.StandardTypes.OID;
import static io.sqlsmith.spi.type.StandardTypes.REGCLASS;
import static io.sqlsmith.spi.type.StandardTypes.REGNAMESPACE;
import static io.sqlsmith.spi.type.StandardTypes.REGPROC;
import static io.sqlsmith.spi.type.StandardTypes.REGPROCEDURE;
import static io.sqlsmith.spi.type.StandardTypes.REGROLE;
import static io.sqlsmith.spi.type.StandardTypes.REGTYPE;
import static io.sqlsmith.spi.type.StandardTypes.STRING;
import static io.sqlsmith.spi.type.StandardTypes.TIME;
import static io.sqlsmith.spi.type.StandardTypes.TIMESTAMP;
import static io.sqlsmith.spi.type.StandardTypes.TIMESTAMPTZ;
import static io.sqlsmith.spi.type.StandardTypes.TIMETZ;
import static io.sqlsmith.spi.type.StandardTypes.UNKNOWN;
import static io.sqlsmith.spi.type.StandardTypes.UUID;
import static io.sqlsmith.spi.type.StandardTypes.VARBIT;
import static io.sqlsmith.spi.type.StandardTypes.VARCHAR;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Resolves the textual column type reported by schema introspection
 * (for example {@code INT8}, {@code STRING(10)} or {@code DECIMAL(10,2)[]})
 * to a {@link SqlType}. Type modifiers in parentheses and a trailing
 * {@code COLLATE <locale>} clause do not change the type.
 * <p>
 * Types the engine reports but no generator can produce values for, such as
 * spatial and text search types, resolve to {@code UNKNOWN}.
 * Any other name is rejected with {@code TYPE_NOT_FOUND}.
 */
public final class SqlTypeNames
{
    private static final String ARRAY_SUFFIX = "[]";
    private static final Pattern TYPE_MODIFIERS = Pattern.compile("\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COLLATION = Pattern.compile("\\s+COLLATE\\s+\\S+$");

    private static final Map<String, SqlType> TYPES_BY_NAME = ImmutableMap.<String, SqlType>builder()
            .put("BOOL", BOOL)
            .put("BOOLEAN", BOOL)
            .put("INT2", INT2)
            .put("SMALLINT", INT2)
            .put("INT4", INT4)
            .put("INTEGER", INT4)
            .put("INT8", INT8)
            .put("INT", INT8)
            .put("INT64", INT8)
            .put("BIGINT", INT8)
            .put("FLOAT4", FLOAT4)
            .put("REAL", FLOAT4)
            .put("FLOAT8", FLOAT8)
            .put("FLOAT", FLOAT8)
            .put("DOUBLE", FLOAT8)
            .put("DOUBLE PRECISION", FLOAT8)
            .put("DECIMAL", DECIMAL)
            .put("DEC", DECIMAL)
            .put("NUMERIC", DECIMAL)
            .put("STRING", STRING)
            .put("TEXT", STRING)
            .put("VARCHAR", VARCHAR)
            .put("CHARACTER VARYING", VARCHAR)
            .put("CHAR", CHAR)
            .put("CHARACTER", CHAR)
            .put("BPCHAR", CHAR)
            .put("BYTES", BYTES)
            .put("BYTEA", BYTES)
            .put("BLOB", BYTES)
            .put("DATE", DATE)
            .put("TIME", TIME)
            .put("TIME WITHOUT TIME ZONE", TIME)
            .put("TIMETZ", TIMETZ)
            .put("TIME WITH TIME ZONE", TIMETZ)
            .put("TIMESTAMP", TIMESTAMP)
            .put("TIMESTAMP WITHOUT TIME ZONE", TIMESTAMP)
            .put("TIMESTAMPTZ", TIMESTAMPTZ)
            .put("TIMESTAMP WITH TIME ZONE", TIMESTAMPTZ)
            .put("INTERVAL", INTERVAL)
            .put("UUID", UUID)
            .put("INET", INET)
            .put("JSONB", JSONB)
            .put("JSON", JSONB)
            .put("BIT", BIT)
            .put("VARBIT", VARBIT)
            .put("BIT VARYING", VARBIT)
            .put("NAME", NAME)
            .put("OID", OID)
            .put("REGPROC", REGPROC)
            .put("REGPROCEDURE", REGPROCEDURE)
            .put("REGCLASS", REGCLASS)
            .put("REGTYPE", REGTYPE)
            .put("REGNAMESPACE", REGNAMESPACE)
            .put("REGROLE", REGROLE)
            .put("GEOMETRY", UNKNOWN)
            .put("GEOGRAPHY", UNKNOWN)
            .put("BOX2D", UNKNOWN)
            .put("TSVECTOR", UNKNOWN)
            .put("TSQUERY", UNKNOWN)
            .put("PG_LSN", UNKNOWN)
            .put("REFCURSOR", UNKNOWN)
            .put("INT2VECTOR", UNKNOWN)
            .put("OIDVECTOR", UNKNOWN)
            .buildOrThrow();

    private static final Map<SqlType, SqlType> ARRAY_TYPES_BY_ELEMENT = ALL_TYPES.stream()
            .filter(SqlType::isArray)
            .collect(toImmutableMap(type -> type.getElementType().orElseThrow(), type -> type));

    private SqlTypeNames() {}

    public static SqlType fromName(String typeName)
    {
        return lookup(typeName)
                .orElseThrow(() -> new SqlsmithException(TYPE_NOT_FOUND, "Unknown type name: " + typeName));
    }

    public static Optional<SqlType> lookup(String typeName)
    {
        requireNonNull(typeName, "typeName is null");
        String name = typeName.trim().toUpperCase(ENGLISH);
        if (name.endsWith(ARRAY_SUFFIX)) {
            return lookupScalar(name.substring(0, name.length() - ARRAY_SUFFIX.length()))
                    .map(elementType -> ARRAY_TYPES_BY_ELEMENT.getOrDefault(elementType, UNKNOWN));
        }
        return lookupScalar(name);
    }

    private static Optional<SqlType> lookupScalar(String name)
    {
        String baseName = COLLATION.matcher(name.trim()).replaceAll("");
        baseName = TYPE_MODIFIERS.matcher(baseName).replaceAll("");
        baseName = WHITESPACE.matcher(baseName.trim()).replaceAll(" ");
        return Optional.ofNullable(TYPES_BY_NAME.get(baseName));
    }
}

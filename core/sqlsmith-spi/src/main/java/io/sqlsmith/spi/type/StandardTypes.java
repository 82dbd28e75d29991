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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static io.sqlsmith.spi.type.SqlType.createArrayType;
import static io.sqlsmith.spi.type.SqlType.createType;

/**
 * Types known to the target engine, identified by their PostgreSQL-compatible oids.
 */
public final class StandardTypes
{
    public static final SqlType BOOL = createType("bool", 16, TypeFamily.BOOL);
    public static final SqlType BYTES = createType("bytes", 17, TypeFamily.BYTES);
    public static final SqlType NAME = createType("name", 19, TypeFamily.STRING);
    public static final SqlType INT8 = createType("int8", 20, TypeFamily.INT);
    public static final SqlType INT2 = createType("int2", 21, TypeFamily.INT);
    public static final SqlType INT4 = createType("int4", 23, TypeFamily.INT);
    public static final SqlType REGPROC = createType("regproc", 24, TypeFamily.OID);
    public static final SqlType STRING = createType("string", 25, TypeFamily.STRING);
    public static final SqlType OID = createType("oid", 26, TypeFamily.OID);
    public static final SqlType FLOAT4 = createType("float4", 700, TypeFamily.FLOAT);
    public static final SqlType FLOAT8 = createType("float8", 701, TypeFamily.FLOAT);
    public static final SqlType UNKNOWN = createType("unknown", 705, TypeFamily.UNKNOWN);
    public static final SqlType INET = createType("inet", 869, TypeFamily.INET);
    public static final SqlType CHAR = createType("char", 1042, TypeFamily.STRING);
    public static final SqlType VARCHAR = createType("varchar", 1043, TypeFamily.STRING);
    public static final SqlType DATE = createType("date", 1082, TypeFamily.DATE);
    public static final SqlType TIME = createType("time", 1083, TypeFamily.TIME);
    public static final SqlType TIMESTAMP = createType("timestamp", 1114, TypeFamily.TIMESTAMP);
    public static final SqlType TIMESTAMPTZ = createType("timestamptz", 1184, TypeFamily.TIMESTAMPTZ);
    public static final SqlType INTERVAL = createType("interval", 1186, TypeFamily.INTERVAL);
    public static final SqlType TIMETZ = createType("timetz", 1266, TypeFamily.TIMETZ);
    public static final SqlType BIT = createType("bit", 1560, TypeFamily.BIT);
    public static final SqlType VARBIT = createType("varbit", 1562, TypeFamily.BIT);
    public static final SqlType DECIMAL = createType("decimal", 1700, TypeFamily.DECIMAL);
    public static final SqlType REGPROCEDURE = createType("regprocedure", 2202, TypeFamily.OID);
    public static final SqlType REGCLASS = createType("regclass", 2205, TypeFamily.OID);
    public static final SqlType REGTYPE = createType("regtype", 2206, TypeFamily.OID);
    public static final SqlType TUPLE = createType("record", 2249, TypeFamily.TUPLE);
    public static final SqlType ANY = createType("anyelement", 2283, TypeFamily.ANY);
    public static final SqlType UUID = createType("uuid", 2950, TypeFamily.UUID);
    public static final SqlType JSONB = createType("jsonb", 3802, TypeFamily.JSONB);
    public static final SqlType REGNAMESPACE = createType("regnamespace", 4089, TypeFamily.OID);
    public static final SqlType REGROLE = createType("regrole", 4096, TypeFamily.OID);

    public static final SqlType BOOL_ARRAY = createArrayType(BOOL, 1000);
    public static final SqlType BYTES_ARRAY = createArrayType(BYTES, 1001);
    public static final SqlType NAME_ARRAY = createArrayType(NAME, 1003);
    public static final SqlType INT2_ARRAY = createArrayType(INT2, 1005);
    public static final SqlType INT4_ARRAY = createArrayType(INT4, 1007);
    public static final SqlType STRING_ARRAY = createArrayType(STRING, 1009);
    public static final SqlType CHAR_ARRAY = createArrayType(CHAR, 1014);
    public static final SqlType VARCHAR_ARRAY = createArrayType(VARCHAR, 1015);
    public static final SqlType INT8_ARRAY = createArrayType(INT8, 1016);
    public static final SqlType FLOAT4_ARRAY = createArrayType(FLOAT4, 1021);
    public static final SqlType FLOAT8_ARRAY = createArrayType(FLOAT8, 1022);
    public static final SqlType OID_ARRAY = createArrayType(OID, 1028);
    public static final SqlType INET_ARRAY = createArrayType(INET, 1041);
    public static final SqlType TIMESTAMP_ARRAY = createArrayType(TIMESTAMP, 1115);
    public static final SqlType DATE_ARRAY = createArrayType(DATE, 1182);
    public static final SqlType TIME_ARRAY = createArrayType(TIME, 1183);
    public static final SqlType TIMESTAMPTZ_ARRAY = createArrayType(TIMESTAMPTZ, 1185);
    public static final SqlType INTERVAL_ARRAY = createArrayType(INTERVAL, 1187);
    public static final SqlType TIMETZ_ARRAY = createArrayType(TIMETZ, 1270);
    public static final SqlType BIT_ARRAY = createArrayType(BIT, 1561);
    public static final SqlType VARBIT_ARRAY = createArrayType(VARBIT, 1563);
    public static final SqlType DECIMAL_ARRAY = createArrayType(DECIMAL, 1231);
    public static final SqlType UUID_ARRAY = createArrayType(UUID, 2951);
    public static final SqlType JSONB_ARRAY = createArrayType(JSONB, 3807);

    /**
     * Canonical representatives of every semantic family a generated scalar
     * expression may produce. Arrays, tuples and pseudo types are not members.
     */
    public static final List<SqlType> ANY_NON_ARRAY = ImmutableList.of(
            BOOL,
            INT8,
            FLOAT8,
            DECIMAL,
            DATE,
            TIMESTAMP,
            INTERVAL,
            STRING,
            BYTES,
            TIMESTAMPTZ,
            OID,
            UUID,
            INET,
            TIME,
            JSONB);

    private static final Set<TypeFamily> NON_ARRAY_FAMILIES = ANY_NON_ARRAY.stream()
            .map(SqlType::getFamily)
            .collect(toImmutableSet());

    public static final List<SqlType> ALL_TYPES = ImmutableList.<SqlType>builder()
            .add(BOOL, BYTES, INT8, INT2, INT4, STRING, OID, FLOAT4, FLOAT8, UNKNOWN, INET, CHAR, VARCHAR)
            .add(DATE, TIME, TIMESTAMP, TIMESTAMPTZ, INTERVAL, DECIMAL, TUPLE, ANY, UUID, JSONB)
            .add(BOOL_ARRAY, BYTES_ARRAY, INT2_ARRAY, INT4_ARRAY, STRING_ARRAY, VARCHAR_ARRAY, INT8_ARRAY)
            .add(FLOAT4_ARRAY, FLOAT8_ARRAY, OID_ARRAY, INET_ARRAY, TIMESTAMP_ARRAY, DATE_ARRAY, TIME_ARRAY)
            .add(TIMESTAMPTZ_ARRAY, INTERVAL_ARRAY, DECIMAL_ARRAY, UUID_ARRAY, JSONB_ARRAY)
            .add(NAME, REGPROC, TIMETZ, BIT, VARBIT, REGPROCEDURE, REGCLASS, REGTYPE, REGNAMESPACE, REGROLE)
            .add(NAME_ARRAY, CHAR_ARRAY, TIMETZ_ARRAY, BIT_ARRAY, VARBIT_ARRAY)
            .build();

    private StandardTypes() {}

    public static Set<TypeFamily> nonArrayFamilies()
    {
        return ImmutableSet.copyOf(NON_ARRAY_FAMILIES);
    }

    public static boolean isNonArrayFamily(TypeFamily family)
    {
        return NON_ARRAY_FAMILIES.contains(family);
    }
}

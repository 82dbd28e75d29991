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
package io.sqlsmith.builtin;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.sqlsmith.spi.function.BinaryOperator;
import io.sqlsmith.spi.function.BinaryOperatorOverload;
import io.sqlsmith.spi.function.FunctionDefinition;
import io.sqlsmith.spi.function.FunctionKind;
import io.sqlsmith.spi.function.FunctionOverload;
import io.sqlsmith.spi.function.SignatureRegistry;
import io.sqlsmith.spi.type.SqlType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static io.sqlsmith.spi.function.BinaryOperator.BITAND;
import static io.sqlsmith.spi.function.BinaryOperator.BITOR;
import static io.sqlsmith.spi.function.BinaryOperator.BITXOR;
import static io.sqlsmith.spi.function.BinaryOperator.CONCAT;
import static io.sqlsmith.spi.function.BinaryOperator.DIV;
import static io.sqlsmith.spi.function.BinaryOperator.FLOOR_DIV;
import static io.sqlsmith.spi.function.BinaryOperator.JSON_FETCH_TEXT;
import static io.sqlsmith.spi.function.BinaryOperator.JSON_FETCH_TEXT_PATH;
import static io.sqlsmith.spi.function.BinaryOperator.JSON_FETCH_VAL;
import static io.sqlsmith.spi.function.BinaryOperator.JSON_FETCH_VAL_PATH;
import static io.sqlsmith.spi.function.BinaryOperator.LSHIFT;
import static io.sqlsmith.spi.function.BinaryOperator.MINUS;
import static io.sqlsmith.spi.function.BinaryOperator.MOD;
import static io.sqlsmith.spi.function.BinaryOperator.MULT;
import static io.sqlsmith.spi.function.BinaryOperator.PLUS;
import static io.sqlsmith.spi.function.BinaryOperator.POW;
import static io.sqlsmith.spi.function.BinaryOperator.RSHIFT;
import static io.sqlsmith.spi.function.FunctionDefinition.COMPATIBILITY_CATEGORY;
import static io.sqlsmith.spi.function.FunctionKind.AGGREGATE;
import static io.sqlsmith.spi.function.FunctionKind.GENERATOR;
import static io.sqlsmith.spi.function.FunctionKind.SCALAR;
import static io.sqlsmith.spi.function.FunctionKind.WINDOW;
import static io.sqlsmith.spi.type.StandardTypes.ANY;
import static io.sqlsmith.spi.type.StandardTypes.BOOL;
import static io.sqlsmith.spi.type.StandardTypes.BYTES;
import static io.sqlsmith.spi.type.StandardTypes.DATE;
import static io.sqlsmith.spi.type.StandardTypes.DECIMAL;
import static io.sqlsmith.spi.type.StandardTypes.FLOAT8;
import static io.sqlsmith.spi.type.StandardTypes.INET;
import static io.sqlsmith.spi.type.StandardTypes.INT8;
import static io.sqlsmith.spi.type.StandardTypes.INT8_ARRAY;
import static io.sqlsmith.spi.type.StandardTypes.INTERVAL;
import static io.sqlsmith.spi.type.StandardTypes.JSONB;
import static io.sqlsmith.spi.type.StandardTypes.OID;
import static io.sqlsmith.spi.type.StandardTypes.STRING;
import static io.sqlsmith.spi.type.StandardTypes.STRING_ARRAY;
import static io.sqlsmith.spi.type.StandardTypes.TIME;
import static io.sqlsmith.spi.type.StandardTypes.TIMESTAMP;
import static io.sqlsmith.spi.type.StandardTypes.TIMESTAMPTZ;
import static io.sqlsmith.spi.type.StandardTypes.TUPLE;
import static io.sqlsmith.spi.type.StandardTypes.UUID;
import static java.util.Objects.requireNonNull;

/**
 * Operators and functions of the engine under test, registered in a fixed order.
 */
public final class BuiltinSignatureRegistry
        implements SignatureRegistry
{
    private static final String MATH = "Math and numeric";
    private static final String STRINGS = "String and byte";
    private static final String DATE_TIME = "Date and time";
    private static final String ID_GENERATION = "ID generation";
    private static final String JSON = "JSONB";
    private static final String ARRAYS = "Array";
    private static final String SYSTEM_INFO = "System info";
    private static final String COMPARISON = "Comparison";

    private static final String PG_COMPATIBLE = "Not usable; exposed only for compatibility with PostgreSQL.";

    private final Map<BinaryOperator, List<BinaryOperatorOverload>> binaryOperators;
    private final List<FunctionDefinition> functions;

    public BuiltinSignatureRegistry()
    {
        this.binaryOperators = buildBinaryOperators();
        this.functions = buildFunctions();
    }

    @Override
    public Map<BinaryOperator, List<BinaryOperatorOverload>> getBinaryOperators()
    {
        return binaryOperators;
    }

    @Override
    public List<FunctionDefinition> getFunctions()
    {
        return functions;
    }

    private static Map<BinaryOperator, List<BinaryOperatorOverload>> buildBinaryOperators()
    {
        return new OperatorListBuilder()
                .operator(BITAND, INT8, INT8, INT8)
                .operator(BITAND, INET, INET, INET)
                .operator(BITOR, INT8, INT8, INT8)
                .operator(BITOR, INET, INET, INET)
                .operator(BITXOR, INT8, INT8, INT8)
                .operator(PLUS, INT8, INT8, INT8)
                .operator(PLUS, FLOAT8, FLOAT8, FLOAT8)
                .operator(PLUS, DECIMAL, DECIMAL, DECIMAL)
                .operator(PLUS, DECIMAL, INT8, DECIMAL)
                .operator(PLUS, INT8, DECIMAL, DECIMAL)
                .operator(PLUS, DATE, INT8, DATE)
                .operator(PLUS, INT8, DATE, DATE)
                .operator(PLUS, DATE, INTERVAL, TIMESTAMP)
                .operator(PLUS, TIMESTAMP, INTERVAL, TIMESTAMP)
                .operator(PLUS, TIMESTAMPTZ, INTERVAL, TIMESTAMPTZ)
                .operator(PLUS, TIME, INTERVAL, TIME)
                .operator(PLUS, INTERVAL, INTERVAL, INTERVAL)
                .operator(PLUS, INET, INT8, INET)
                .operator(MINUS, INT8, INT8, INT8)
                .operator(MINUS, FLOAT8, FLOAT8, FLOAT8)
                .operator(MINUS, DECIMAL, DECIMAL, DECIMAL)
                .operator(MINUS, DATE, DATE, INT8)
                .operator(MINUS, DATE, INT8, DATE)
                .operator(MINUS, TIMESTAMP, TIMESTAMP, INTERVAL)
                .operator(MINUS, TIMESTAMPTZ, TIMESTAMPTZ, INTERVAL)
                .operator(MINUS, TIMESTAMP, INTERVAL, TIMESTAMP)
                .operator(MINUS, INTERVAL, INTERVAL, INTERVAL)
                .operator(MINUS, JSONB, STRING, JSONB)
                .operator(MINUS, INET, INET, INT8)
                .operator(MULT, INT8, INT8, INT8)
                .operator(MULT, FLOAT8, FLOAT8, FLOAT8)
                .operator(MULT, DECIMAL, DECIMAL, DECIMAL)
                .operator(MULT, INTERVAL, INT8, INTERVAL)
                .operator(MULT, INT8, INTERVAL, INTERVAL)
                .operator(MULT, INTERVAL, FLOAT8, INTERVAL)
                .operator(DIV, INT8, INT8, DECIMAL)
                .operator(DIV, FLOAT8, FLOAT8, FLOAT8)
                .operator(DIV, DECIMAL, DECIMAL, DECIMAL)
                .operator(DIV, INTERVAL, INT8, INTERVAL)
                .operator(FLOOR_DIV, INT8, INT8, INT8)
                .operator(FLOOR_DIV, FLOAT8, FLOAT8, FLOAT8)
                .operator(FLOOR_DIV, DECIMAL, DECIMAL, DECIMAL)
                .operator(MOD, INT8, INT8, INT8)
                .operator(MOD, FLOAT8, FLOAT8, FLOAT8)
                .operator(MOD, DECIMAL, DECIMAL, DECIMAL)
                .operator(POW, INT8, INT8, INT8)
                .operator(POW, FLOAT8, FLOAT8, FLOAT8)
                .operator(POW, DECIMAL, DECIMAL, DECIMAL)
                .operator(CONCAT, STRING, STRING, STRING)
                .operator(CONCAT, BYTES, BYTES, BYTES)
                .operator(CONCAT, JSONB, JSONB, JSONB)
                .operator(CONCAT, INT8_ARRAY, INT8, INT8_ARRAY)
                .operator(CONCAT, STRING_ARRAY, STRING_ARRAY, STRING_ARRAY)
                .operator(LSHIFT, INT8, INT8, INT8)
                .operator(LSHIFT, INET, INET, BOOL)
                .operator(RSHIFT, INT8, INT8, INT8)
                .operator(RSHIFT, INET, INET, BOOL)
                .operator(JSON_FETCH_VAL, JSONB, STRING, JSONB)
                .operator(JSON_FETCH_VAL, JSONB, INT8, JSONB)
                .operator(JSON_FETCH_TEXT, JSONB, STRING, STRING)
                .operator(JSON_FETCH_TEXT, JSONB, INT8, STRING)
                .operator(JSON_FETCH_VAL_PATH, JSONB, STRING_ARRAY, JSONB)
                .operator(JSON_FETCH_TEXT_PATH, JSONB, STRING_ARRAY, STRING)
                .build();
    }

    private static List<FunctionDefinition> buildFunctions()
    {
        return new FunctionListBuilder()
                .scalar("abs", MATH)
                .overload(INT8, "Calculates the absolute value of `val`.", INT8)
                .overload(FLOAT8, "Calculates the absolute value of `val`.", FLOAT8)
                .overload(DECIMAL, "Calculates the absolute value of `val`.", DECIMAL)
                .scalar("sqrt", MATH)
                .overload(FLOAT8, "Calculates the square root of `val`.", FLOAT8)
                .overload(DECIMAL, "Calculates the square root of `val`.", DECIMAL)
                .scalar("floor", MATH)
                .overload(FLOAT8, "Calculates the largest integer not greater than `val`.", FLOAT8)
                .overload(DECIMAL, "Calculates the largest integer not greater than `val`.", DECIMAL)
                .scalar("ceil", MATH)
                .overload(FLOAT8, "Calculates the smallest integer not smaller than `val`.", FLOAT8)
                .overload(DECIMAL, "Calculates the smallest integer not smaller than `val`.", DECIMAL)
                .scalar("round", MATH)
                .overload(FLOAT8, "Rounds `val` to the nearest integer.", FLOAT8)
                .overload(DECIMAL, "Keeps `decimal_accuracy` number of figures to the right of the zero position.", DECIMAL, INT8)
                .scalar("mod", MATH)
                .overload(INT8, "Calculates `x`%`y`.", INT8, INT8)
                .overload(DECIMAL, "Calculates `x`%`y`.", DECIMAL, DECIMAL)
                .scalar("pi", MATH)
                .overload(FLOAT8, "Returns the value for pi (3.141592653589793).")
                .scalar("random", MATH)
                .volatileOverload(FLOAT8, "Returns a random float between 0 and 1.")
                .scalar("length", STRINGS)
                .overload(INT8, "Calculates the number of characters in `val`.", STRING)
                .overload(INT8, "Calculates the number of bytes in `val`.", BYTES)
                .scalar("lower", STRINGS)
                .overload(STRING, "Converts all characters in `val` to their lower-case equivalents.", STRING)
                .scalar("upper", STRINGS)
                .overload(STRING, "Converts all characters in `val` to their upper-case equivalents.", STRING)
                .scalar("substr", STRINGS)
                .overload(STRING, "Returns a substring of `input` starting at `start_pos` (count starts at 1).", STRING, INT8)
                .overload(STRING, "Returns a substring of `input` between `start_pos` and `start_pos` + `length`.", STRING, INT8, INT8)
                .scalar("repeat", STRINGS)
                .overload(STRING, "Concatenates `input` `repeat_counter` number of times.", STRING, INT8)
                .scalar("md5", STRINGS)
                .overload(STRING, "Calculates the MD5 hash value of a set of values.", STRING)
                .overload(STRING, "Calculates the MD5 hash value of a set of values.", BYTES)
                .scalar("to_hex", STRINGS)
                .overload(STRING, "Converts `val` to its hexadecimal representation.", INT8)
                .overload(STRING, "Converts `val` to its hexadecimal representation.", BYTES)
                .scalar("split_part", STRINGS)
                .overload(STRING, "Splits `input` on `delimiter` and return the value in the `return_index_pos` position.", STRING, STRING, INT8)
                .scalar("string_to_array", STRINGS)
                .overload(STRING_ARRAY, "Split a string into components on a delimiter.", STRING, STRING)
                .scalar("now", DATE_TIME)
                .volatileOverload(TIMESTAMPTZ, "Returns the time of the current transaction.")
                .scalar("current_date", DATE_TIME)
                .volatileOverload(DATE, "Returns the date of the current transaction.")
                .scalar("extract", DATE_TIME)
                .overload(FLOAT8, "Extracts `element` from `input`.", STRING, TIMESTAMP)
                .overload(FLOAT8, "Extracts `element` from `input`.", STRING, DATE)
                .scalar("age", DATE_TIME)
                .overload(INTERVAL, "Calculates the interval between `end` and `begin`.", TIMESTAMPTZ, TIMESTAMPTZ)
                .scalar("date_trunc", DATE_TIME)
                .overload(TIMESTAMP, "Truncates `input` to precision `element`.", STRING, TIMESTAMP)
                .overload(TIMESTAMPTZ, "Truncates `input` to precision `element`.", STRING, TIMESTAMPTZ)
                .scalar("gen_random_uuid", ID_GENERATION)
                .volatileOverload(UUID, "Generates a random UUID and returns it as a value of UUID type.")
                .scalar("unique_rowid", ID_GENERATION)
                .volatileOverload(INT8, "Returns a unique ID used by CockroachDB to generate unique row IDs if a primary key isn't defined for the table.")
                .scalar("jsonb_typeof", JSON)
                .overload(STRING, "Returns the type of the outermost JSON value as a text string.", JSONB)
                .scalar("jsonb_array_length", JSON)
                .overload(INT8, "Returns the number of elements in the outermost JSON or JSONB array.", JSONB)
                .scalar("jsonb_pretty", JSON)
                .overload(STRING, "Returns the given JSON value as a STRING indented and with newlines.", JSONB)
                .scalar("array_length", ARRAYS)
                .overload(INT8, "Calculates the length of `input` on the provided `array_dimension`.", INT8_ARRAY, INT8)
                .scalar("array_append", ARRAYS)
                .overload(INT8_ARRAY, "Appends `elem` to `array`, returning the result.", INT8_ARRAY, INT8)
                .scalar("greatest", COMPARISON)
                .overload(ANY, "Returns the element with the greatest value.", ANY, ANY)
                .scalar("least", COMPARISON)
                .overload(ANY, "Returns the element with the lowest value.", ANY, ANY)
                .scalar("version", SYSTEM_INFO)
                .overload(STRING, "Returns the node's version of CockroachDB.")
                .scalar("current_database", SYSTEM_INFO)
                .overload(STRING, "Returns the current database.")
                .scalar("to_regclass", SYSTEM_INFO)
                .overload(OID, PG_COMPATIBLE, STRING)
                .scalar("pg_sleep", SYSTEM_INFO)
                .volatileOverload(BOOL, "pg_sleep makes the current session's process sleep until seconds seconds have elapsed.", FLOAT8)
                .scalar("crdb_internal.force_error", SYSTEM_INFO)
                .volatileOverload(INT8, "This function is used only by CockroachDB's developers for testing purposes.", STRING, STRING)
                .scalar("crdb_internal.force_panic", SYSTEM_INFO)
                .volatileOverload(INT8, "This function is used only by CockroachDB's developers for testing purposes.", STRING)
                .privateScalar("crdb_internal.set_vmodule", SYSTEM_INFO)
                .volatileOverload(INT8, "Set the equivalent of the `--vmodule` flag on the gateway node processing this request.", STRING)
                .scalar("pg_get_indexdef", COMPATIBILITY_CATEGORY)
                .overload(STRING, "Gets the CREATE INDEX command for index_oid.", OID)
                .scalar("obj_description", COMPATIBILITY_CATEGORY)
                .overload(STRING, "Returns the comment for a database object.", OID)
                .scalar("format_type", COMPATIBILITY_CATEGORY)
                .overload(STRING, "Returns the SQL name of a data type that is identified by its type OID and possibly a type modifier.", OID, INT8)
                .aggregate("count")
                .overload(INT8, "Calculates the number of selected elements.", ANY)
                .aggregate("count_rows")
                .overload(INT8, "Calculates the number of rows.")
                .aggregate("sum")
                .overload(DECIMAL, "Calculates the sum of the selected values.", INT8)
                .overload(FLOAT8, "Calculates the sum of the selected values.", FLOAT8)
                .overload(DECIMAL, "Calculates the sum of the selected values.", DECIMAL)
                .overload(INTERVAL, "Calculates the sum of the selected values.", INTERVAL)
                .aggregate("avg")
                .overload(DECIMAL, "Calculates the average of the selected values.", INT8)
                .overload(FLOAT8, "Calculates the average of the selected values.", FLOAT8)
                .overload(DECIMAL, "Calculates the average of the selected values.", DECIMAL)
                .aggregate("max")
                .overload(INT8, "Identifies the maximum selected value.", INT8)
                .overload(STRING, "Identifies the maximum selected value.", STRING)
                .overload(ANY, "Identifies the maximum selected value.", ANY)
                .aggregate("min")
                .overload(INT8, "Identifies the minimum selected value.", INT8)
                .overload(STRING, "Identifies the minimum selected value.", STRING)
                .overload(ANY, "Identifies the minimum selected value.", ANY)
                .aggregate("bool_and")
                .overload(BOOL, "Calculates the boolean value of `AND`ing all selected values.", BOOL)
                .aggregate("bool_or")
                .overload(BOOL, "Calculates the boolean value of `OR`ing all selected values.", BOOL)
                .aggregate("string_agg")
                .overload(STRING, "Concatenates all selected values using the provided delimiter.", STRING, STRING)
                .overload(BYTES, "Concatenates all selected values using the provided delimiter.", BYTES, BYTES)
                .aggregate("array_agg")
                .overload(INT8_ARRAY, "Aggregates the selected values into an array.", INT8)
                .aggregate("variance")
                .overload(FLOAT8, "Calculates the variance of the selected values.", FLOAT8)
                .overload(DECIMAL, "Calculates the variance of the selected values.", DECIMAL)
                .aggregate("json_agg")
                .overload(JSONB, "Aggregates values as a JSON or JSONB array.", ANY)
                .window("row_number")
                .overload(INT8, "Calculates the number of the current row within its partition, counting from 1.")
                .window("rank")
                .overload(INT8, "Calculates the rank of the current row with gaps; same as row_number of its first peer.")
                .window("dense_rank")
                .overload(INT8, "Calculates the rank of the current row without gaps; this function counts peer groups.")
                .window("percent_rank")
                .overload(FLOAT8, "Calculates the relative rank of the current row: (rank - 1) / (total rows - 1).")
                .window("cume_dist")
                .overload(FLOAT8, "Calculates the relative rank of the current row: (number of rows preceding or peer with current row) / (total rows).")
                .window("ntile")
                .overload(INT8, "Calculates an integer ranging from 1 to `n`, dividing the partition as equally as possible.", INT8)
                .window("lag")
                .overload(ANY, "Returns `val` evaluated at the previous row within current row's partition.", ANY)
                .window("first_value")
                .overload(ANY, "Returns `val` evaluated at the row that is the first row of the window frame.", ANY)
                .generator("generate_series")
                .overload(INT8, "Produces a virtual table containing the integer values from `start` to `end`, inclusive.", INT8, INT8)
                .overload(TIMESTAMP, "Produces a virtual table containing the timestamp values from `start` to `end`, inclusive, by increment of `step`.", TIMESTAMP, TIMESTAMP, INTERVAL)
                .generator("unnest")
                .overload(ANY, "Returns the input array as a set of rows", INT8_ARRAY)
                .generator("jsonb_array_elements")
                .overload(JSONB, "Expands a JSON array to a set of JSON values.", JSONB)
                .generator("jsonb_to_recordset")
                .overload(TUPLE, PG_COMPATIBLE, JSONB)
                .build();
    }

    private static final class OperatorListBuilder
    {
        private final Map<BinaryOperator, List<BinaryOperatorOverload>> operators = new LinkedHashMap<>();

        public OperatorListBuilder operator(BinaryOperator operator, SqlType leftType, SqlType rightType, SqlType returnType)
        {
            operators.computeIfAbsent(operator, key -> new ArrayList<>())
                    .add(new BinaryOperatorOverload(leftType, rightType, returnType));
            return this;
        }

        public Map<BinaryOperator, List<BinaryOperatorOverload>> build()
        {
            ImmutableMap.Builder<BinaryOperator, List<BinaryOperatorOverload>> builder = ImmutableMap.builder();
            operators.forEach((operator, overloads) -> builder.put(operator, ImmutableList.copyOf(overloads)));
            return builder.buildOrThrow();
        }
    }

    private static final class FunctionListBuilder
    {
        private final ImmutableList.Builder<FunctionDefinition> functions = ImmutableList.builder();

        private String name;
        private FunctionKind kind;
        private String category;
        private boolean privateFunction;
        private final List<FunctionOverload> overloads = new ArrayList<>();

        public FunctionListBuilder scalar(String name, String category)
        {
            return definition(name, SCALAR, category, false);
        }

        public FunctionListBuilder privateScalar(String name, String category)
        {
            return definition(name, SCALAR, category, true);
        }

        public FunctionListBuilder aggregate(String name)
        {
            return definition(name, AGGREGATE, "Aggregate", false);
        }

        public FunctionListBuilder window(String name)
        {
            return definition(name, WINDOW, "Window", false);
        }

        public FunctionListBuilder generator(String name)
        {
            return definition(name, GENERATOR, "Set-returning", false);
        }

        public FunctionListBuilder overload(SqlType returnType, String info, SqlType... argumentTypes)
        {
            checkArgument(name != null, "no function definition started");
            overloads.add(new FunctionOverload(ImmutableList.copyOf(argumentTypes), returnType, info));
            return this;
        }

        public FunctionListBuilder volatileOverload(SqlType returnType, String info, SqlType... argumentTypes)
        {
            checkArgument(name != null, "no function definition started");
            overloads.add(new FunctionOverload(ImmutableList.copyOf(argumentTypes), returnType, info, false, false));
            return this;
        }

        public List<FunctionDefinition> build()
        {
            finishDefinition();
            return functions.build();
        }

        private FunctionListBuilder definition(String name, FunctionKind kind, String category, boolean privateFunction)
        {
            finishDefinition();
            this.name = requireNonNull(name, "name is null");
            this.kind = requireNonNull(kind, "kind is null");
            this.category = requireNonNull(category, "category is null");
            this.privateFunction = privateFunction;
            return this;
        }

        private void finishDefinition()
        {
            if (name != null) {
                functions.add(new FunctionDefinition(name, kind, category, privateFunction, overloads));
                overloads.clear();
                name = null;
            }
        }
    }
}

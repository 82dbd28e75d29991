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

import static java.util.Objects.requireNonNull;

public enum BinaryOperator
{
    BITAND("&"),
    BITOR("|"),
    BITXOR("#"),
    PLUS("+"),
    MINUS("-"),
    MULT("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("^"),
    CONCAT("||"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    JSON_FETCH_VAL("->"),
    JSON_FETCH_TEXT("->>"),
    JSON_FETCH_VAL_PATH("#>"),
    JSON_FETCH_TEXT_PATH("#>>");

    private final String symbol;

    BinaryOperator(String symbol)
    {
        this.symbol = requireNonNull(symbol, "symbol is null");
    }

    public String getSymbol()
    {
        return symbol;
    }

    @Override
    public String toString()
    {
        return symbol;
    }
}

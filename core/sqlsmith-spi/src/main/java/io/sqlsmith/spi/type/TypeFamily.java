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

/**
 * Semantic category of a {@link SqlType}. Types of different widths
 * (for example {@code INT2} and {@code INT8}) share a family.
 */
public enum TypeFamily
{
    BOOL,
    INT,
    FLOAT,
    DECIMAL,
    DATE,
    TIME,
    TIMETZ,
    TIMESTAMP,
    TIMESTAMPTZ,
    INTERVAL,
    STRING,
    BYTES,
    BIT,
    UUID,
    INET,
    JSONB,
    OID,
    ARRAY,
    TUPLE,
    ANY,
    UNKNOWN,
}

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

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the operator and function signatures understood by the
 * engine under test. Implementations must return the same content on every call.
 */
public interface SignatureRegistry
{
    Map<BinaryOperator, List<BinaryOperatorOverload>> getBinaryOperators();

    List<FunctionDefinition> getFunctions();
}

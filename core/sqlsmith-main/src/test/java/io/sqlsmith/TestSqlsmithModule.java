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
package io.sqlsmith;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.bootstrap.LifeCycleManager;
import io.sqlsmith.catalog.FunctionCatalog;
import io.sqlsmith.catalog.OperatorCatalog;
import io.sqlsmith.schema.SchemaCache;
import io.sqlsmith.schema.SchemaRefreshTask;
import io.sqlsmith.spi.function.FunctionKind;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static io.sqlsmith.schema.IndexChoice.Outcome.NO_TABLES;
import static io.sqlsmith.spi.type.StandardTypes.INT8;
import static org.assertj.core.api.Assertions.assertThat;

class TestSqlsmithModule
{
    private static final Key<Optional<Jdbi>> JDBI_KEY = Key.get(new TypeLiteral<>() {});

    @Test
    void testWithoutConnection()
    {
        Injector injector = createInjector(ImmutableMap.of());
        try {
            assertThat(injector.getInstance(JDBI_KEY)).isEmpty();

            SchemaCache cache = injector.getInstance(SchemaCache.class);
            cache.refresh();
            assertThat(cache.getTables()).isEmpty();
            assertThat(cache.pickRandomIndex().outcome()).isEqualTo(NO_TABLES);

            assertThat(injector.getInstance(SchemaRefreshTask.class).isStarted()).isFalse();
        }
        finally {
            injector.getInstance(LifeCycleManager.class).stop();
        }
    }

    @Test
    void testCatalogsAreBuiltOnce()
    {
        Injector injector = createInjector(ImmutableMap.of());
        try {
            OperatorCatalog operators = injector.getInstance(OperatorCatalog.class);
            FunctionCatalog functions = injector.getInstance(FunctionCatalog.class);

            assertThat(injector.getInstance(OperatorCatalog.class)).isSameAs(operators);
            assertThat(injector.getInstance(FunctionCatalog.class)).isSameAs(functions);
            assertThat(operators.getOperators(INT8.getTypeId())).isNotEmpty();
            assertThat(functions.getFunctions(FunctionKind.SCALAR, INT8.getTypeId())).isNotEmpty();
        }
        finally {
            injector.getInstance(LifeCycleManager.class).stop();
        }
    }

    @Test
    void testConfiguredConnectionAndSeed()
    {
        Injector injector = createInjector(ImmutableMap.<String, String>builder()
                .put("sqlsmith.connection-url", "jdbc:h2:mem:module_test")
                .put("sqlsmith.random-seed", "7")
                .put("sqlsmith.refresh.enabled", "true")
                .put("sqlsmith.refresh.interval", "1h")
                .buildOrThrow());
        try {
            assertThat(injector.getInstance(JDBI_KEY)).isPresent();
            assertThat(injector.getInstance(Random.class).nextLong()).isEqualTo(new Random(7).nextLong());
            assertThat(injector.getInstance(SchemaRefreshTask.class).isStarted()).isTrue();
        }
        finally {
            injector.getInstance(LifeCycleManager.class).stop();
        }
    }

    private static Injector createInjector(Map<String, String> properties)
    {
        return new Bootstrap(new SqlsmithModule())
                .doNotInitializeLogging()
                .quiet()
                .setRequiredConfigurationProperties(properties)
                .initialize();
    }
}

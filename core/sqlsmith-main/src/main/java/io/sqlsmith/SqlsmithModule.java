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

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import io.airlift.log.Logger;
import io.sqlsmith.builtin.BuiltinSignatureRegistry;
import io.sqlsmith.catalog.FunctionCatalog;
import io.sqlsmith.catalog.OperatorCatalog;
import io.sqlsmith.schema.CockroachIntrospectionDialect;
import io.sqlsmith.schema.IntrospectionDialect;
import io.sqlsmith.schema.SchemaCache;
import io.sqlsmith.schema.SchemaCacheConfig;
import io.sqlsmith.schema.SchemaRefreshTask;
import io.sqlsmith.spi.function.SignatureRegistry;
import org.jdbi.v3.core.Jdbi;

import java.util.Optional;
import java.util.Random;

import static com.google.common.base.Strings.nullToEmpty;
import static io.airlift.configuration.ConfigBinder.configBinder;

public class SqlsmithModule
        implements Module
{
    private static final Logger log = Logger.get(SqlsmithModule.class);

    @Override
    public void configure(Binder binder)
    {
        configBinder(binder).bindConfig(SchemaCacheConfig.class);
        binder.bind(SignatureRegistry.class).to(BuiltinSignatureRegistry.class).in(Scopes.SINGLETON);
        binder.bind(IntrospectionDialect.class).to(CockroachIntrospectionDialect.class).in(Scopes.SINGLETON);
        binder.bind(SchemaRefreshTask.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    public static Optional<Jdbi> createJdbi(SchemaCacheConfig config)
    {
        return config.getConnectionUrl()
                .map(url -> {
                    if (config.getConnectionUser() == null) {
                        return Jdbi.create(url);
                    }
                    return Jdbi.create(url, config.getConnectionUser(), nullToEmpty(config.getConnectionPassword()));
                });
    }

    @Provides
    @Singleton
    public static Random createRandom(SchemaCacheConfig config)
    {
        return config.getRandomSeed()
                .map(Random::new)
                .orElseGet(Random::new);
    }

    @Provides
    @Singleton
    public static SchemaCache createSchemaCache(SchemaCacheConfig config, Optional<Jdbi> jdbi, IntrospectionDialect dialect, Random random)
    {
        if (jdbi.isEmpty()) {
            log.info("No connection URL configured, running without schema");
        }
        return new SchemaCache(jdbi, dialect, config.getTargetSchema(), random);
    }

    @Provides
    @Singleton
    public static OperatorCatalog createOperatorCatalog(SignatureRegistry registry)
    {
        OperatorCatalog catalog = OperatorCatalog.build(registry);
        log.info("Registered %s binary operator overloads", catalog.size());
        return catalog;
    }

    @Provides
    @Singleton
    public static FunctionCatalog createFunctionCatalog(SignatureRegistry registry)
    {
        FunctionCatalog catalog = FunctionCatalog.build(registry);
        log.info("Registered %s function overloads", catalog.size());
        return catalog;
    }
}

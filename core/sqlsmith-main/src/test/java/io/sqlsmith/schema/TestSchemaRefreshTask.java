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
package io.sqlsmith.schema;

import io.airlift.units.Duration;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static io.sqlsmith.schema.TestingIntrospectionDialect.addColumn;
import static io.sqlsmith.schema.TestingIntrospectionDialect.clear;
import static io.sqlsmith.schema.TestingIntrospectionDialect.createFixtureDatabase;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

class TestSchemaRefreshTask
{
    @Test
    void testDisabled()
    {
        SchemaRefreshTask task = new SchemaRefreshTask(new SchemaCacheConfig(), SchemaCache.schemaless(new Random()));
        try {
            task.start();
            assertThat(task.isStarted()).isFalse();
        }
        finally {
            task.shutdown();
        }
    }

    @Test
    void testPeriodicRefresh()
            throws InterruptedException
    {
        var jdbi = createFixtureDatabase();
        addColumn(jdbi, "public", "t1", "id", "INT8", false);
        SchemaCache cache = new SchemaCache(Optional.of(jdbi), new TestingIntrospectionDialect(), "public", new Random());

        SchemaCacheConfig config = new SchemaCacheConfig()
                .setRefreshEnabled(true)
                .setRefreshInterval(new Duration(1, SECONDS));
        SchemaRefreshTask task = new SchemaRefreshTask(config, cache);
        try {
            task.start();
            assertThat(task.isStarted()).isTrue();

            long deadline = System.nanoTime() + SECONDS.toNanos(30);
            while (cache.getTables().isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(100);
            }
            assertThat(cache.getTables()).hasSize(1);
        }
        finally {
            task.shutdown();
        }
    }

    @Test
    void testFailedRefreshIsCountedAndRecovers()
    {
        var jdbi = createFixtureDatabase();
        addColumn(jdbi, "public", "t1", "id", "INT8", false);
        SchemaCache cache = new SchemaCache(Optional.of(jdbi), new TestingIntrospectionDialect(), "public", new Random());
        SchemaRefreshTask task = new SchemaRefreshTask(new SchemaCacheConfig(), cache);
        try {
            assertThat(task.refreshSchema()).isTrue();
            assertThat(cache.getTables()).hasSize(1);

            addColumn(jdbi, "public", "t2", "feeling", "MOOD", false);
            assertThat(task.refreshSchema()).isFalse();
            assertThat(task.refreshSchema()).isFalse();
            assertThat(task.getConsecutiveFailures()).isEqualTo(2);
            assertThat(cache.getTables()).hasSize(1);

            clear(jdbi);
            addColumn(jdbi, "public", "t1", "id", "INT8", false);
            addColumn(jdbi, "public", "t2", "id", "INT8", false);
            assertThat(task.refreshSchema()).isTrue();
            assertThat(task.getConsecutiveFailures()).isZero();
            assertThat(cache.getTables()).hasSize(2);
        }
        finally {
            task.shutdown();
        }
    }

    @Test
    void testScheduleSurvivesFailedRefresh()
            throws InterruptedException
    {
        var jdbi = createFixtureDatabase();
        addColumn(jdbi, "public", "t1", "feeling", "MOOD", false);
        SchemaCache cache = new SchemaCache(Optional.of(jdbi), new TestingIntrospectionDialect(), "public", new Random());

        SchemaCacheConfig config = new SchemaCacheConfig()
                .setRefreshEnabled(true)
                .setRefreshInterval(new Duration(1, SECONDS));
        SchemaRefreshTask task = new SchemaRefreshTask(config, cache);
        try {
            task.start();

            long deadline = System.nanoTime() + SECONDS.toNanos(30);
            while (task.getConsecutiveFailures() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(100);
            }
            assertThat(task.getConsecutiveFailures()).isPositive();
            assertThat(cache.getTables()).isEmpty();

            clear(jdbi);
            addColumn(jdbi, "public", "t1", "id", "INT8", false);
            while (cache.getTables().isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(100);
            }
            assertThat(cache.getTables()).hasSize(1);
        }
        finally {
            task.shutdown();
        }
    }
}

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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.configuration.ConfigSecuritySensitive;
import io.airlift.units.Duration;
import io.airlift.units.MinDuration;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;

import static java.util.concurrent.TimeUnit.MINUTES;

public class SchemaCacheConfig
{
    private String connectionUrl;
    private String connectionUser;
    private String connectionPassword;
    private String targetSchema = "public";
    private Long randomSeed;
    private boolean refreshEnabled;
    private Duration refreshInterval = new Duration(1, MINUTES);

    public Optional<String> getConnectionUrl()
    {
        return Optional.ofNullable(connectionUrl);
    }

    @Config("sqlsmith.connection-url")
    @ConfigDescription("JDBC URL of the database under test; when unset no schema is loaded")
    public SchemaCacheConfig setConnectionUrl(String connectionUrl)
    {
        this.connectionUrl = connectionUrl;
        return this;
    }

    public String getConnectionUser()
    {
        return connectionUser;
    }

    @Config("sqlsmith.connection-user")
    public SchemaCacheConfig setConnectionUser(String connectionUser)
    {
        this.connectionUser = connectionUser;
        return this;
    }

    public String getConnectionPassword()
    {
        return connectionPassword;
    }

    @Config("sqlsmith.connection-password")
    @ConfigSecuritySensitive
    public SchemaCacheConfig setConnectionPassword(String connectionPassword)
    {
        this.connectionPassword = connectionPassword;
        return this;
    }

    @NotNull
    public String getTargetSchema()
    {
        return targetSchema;
    }

    @Config("sqlsmith.target-schema")
    @ConfigDescription("Only tables of this schema are loaded")
    public SchemaCacheConfig setTargetSchema(String targetSchema)
    {
        this.targetSchema = targetSchema;
        return this;
    }

    public Optional<Long> getRandomSeed()
    {
        return Optional.ofNullable(randomSeed);
    }

    @Config("sqlsmith.random-seed")
    @ConfigDescription("Seed for random table and index picks; a random seed is used when unset")
    public SchemaCacheConfig setRandomSeed(Long randomSeed)
    {
        this.randomSeed = randomSeed;
        return this;
    }

    public boolean isRefreshEnabled()
    {
        return refreshEnabled;
    }

    @Config("sqlsmith.refresh.enabled")
    public SchemaCacheConfig setRefreshEnabled(boolean refreshEnabled)
    {
        this.refreshEnabled = refreshEnabled;
        return this;
    }

    @MinDuration("1s")
    @NotNull
    public Duration getRefreshInterval()
    {
        return refreshInterval;
    }

    @Config("sqlsmith.refresh.interval")
    public SchemaCacheConfig setRefreshInterval(Duration refreshInterval)
    {
        this.refreshInterval = refreshInterval;
        return this;
    }
}

/*
 * Copyright 2024 Inscope Metrics
 *
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
package com.arpnetworking.statistics.utility;

import com.arpnetworking.statistics.configuration.DatabaseConfiguration;
import com.arpnetworking.statistics.models.ebean.PersistedStoragePage;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import io.ebean.DatabaseFactory;
import io.ebean.config.DatabaseConfig;
import io.ebean.datasource.DataSourceConfig;

/**
 * Owns the Ebean server backing the page store.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class Database {

    /**
     * Public constructor.
     *
     * @param name the name of the database
     * @param configuration the connection settings
     */
    public Database(final String name, final DatabaseConfiguration configuration) {
        this(name, createEbeanServer(name, configuration));
    }

    /**
     * Wrap an existing Ebean server.
     *
     * @param name the name of the database
     * @param ebeanServer the Ebean server
     */
    public Database(final String name, final io.ebean.Database ebeanServer) {
        _name = name;
        _ebeanServer = ebeanServer;
    }

    public String getName() {
        return _name;
    }

    public io.ebean.Database getEbeanServer() {
        return _ebeanServer;
    }

    /**
     * Shut down the Ebean server and its connection pool.
     */
    public void shutdown() {
        LOGGER.info()
                .setMessage("Shutting down database")
                .addData("name", _name)
                .log();
        _ebeanServer.shutdown();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .toString();
    }

    private static io.ebean.Database createEbeanServer(final String name, final DatabaseConfiguration configuration) {
        final DataSourceConfig dataSourceConfig = new DataSourceConfig();
        dataSourceConfig.setUrl(configuration.getJdbcUrl());
        dataSourceConfig.setDriver(configuration.getDriverName());
        dataSourceConfig.setUsername(configuration.getUsername());
        dataSourceConfig.setPassword(configuration.getPassword());
        dataSourceConfig.setMinConnections(configuration.getMinimumConnections());
        dataSourceConfig.setMaxConnections(configuration.getMaximumConnections());

        final DatabaseConfig databaseConfig = new DatabaseConfig();
        databaseConfig.setName(name);
        databaseConfig.setDataSourceConfig(dataSourceConfig);
        databaseConfig.setDefaultServer(false);
        databaseConfig.setRegister(false);
        databaseConfig.setDdlGenerate(configuration.isRunDdl());
        databaseConfig.setDdlRun(configuration.isRunDdl());
        databaseConfig.addClass(PersistedStoragePage.class);

        LOGGER.info()
                .setMessage("Creating database")
                .addData("name", name)
                .addData("configuration", configuration)
                .log();
        return DatabaseFactory.create(databaseConfig);
    }

    private final String _name;
    private final io.ebean.Database _ebeanServer;

    private static final Logger LOGGER = LoggerFactory.getLogger(Database.class);
}

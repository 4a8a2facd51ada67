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
package com.arpnetworking.statistics.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * Connection settings for the relational page store.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
@JsonDeserialize(builder = DatabaseConfiguration.Builder.class)
public final class DatabaseConfiguration {

    public String getJdbcUrl() {
        return _jdbcUrl;
    }

    public String getDriverName() {
        return _driverName;
    }

    public String getUsername() {
        return _username;
    }

    public String getPassword() {
        return _password;
    }

    public int getMinimumConnections() {
        return _minimumConnections;
    }

    public int getMaximumConnections() {
        return _maximumConnections;
    }

    public boolean isRunDdl() {
        return _runDdl;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("JdbcUrl", _jdbcUrl)
                .add("DriverName", _driverName)
                .add("Username", _username)
                .add("MinimumConnections", _minimumConnections)
                .add("MaximumConnections", _maximumConnections)
                .add("RunDdl", _runDdl)
                .toString();
    }

    private DatabaseConfiguration(final Builder builder) {
        _jdbcUrl = builder._jdbcUrl;
        _driverName = builder._driverName;
        _username = builder._username;
        _password = builder._password;
        _minimumConnections = builder._minimumConnections;
        _maximumConnections = builder._maximumConnections;
        _runDdl = builder._runDdl;
    }

    private final String _jdbcUrl;
    private final String _driverName;
    private final String _username;
    private final String _password;
    private final int _minimumConnections;
    private final int _maximumConnections;
    private final boolean _runDdl;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DatabaseConfiguration}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<DatabaseConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DatabaseConfiguration::new);
        }

        /**
         * Set the JDBC url. Required. Cannot be null or empty.
         *
         * @param value The JDBC url.
         * @return This {@link Builder} instance.
         */
        public Builder setJdbcUrl(final String value) {
            _jdbcUrl = value;
            return this;
        }

        /**
         * Set the JDBC driver class name. Required. Cannot be null or empty.
         *
         * @param value The driver class name.
         * @return This {@link Builder} instance.
         */
        public Builder setDriverName(final String value) {
            _driverName = value;
            return this;
        }

        /**
         * Set the username. Required. Cannot be null.
         *
         * @param value The username.
         * @return This {@link Builder} instance.
         */
        public Builder setUsername(final String value) {
            _username = value;
            return this;
        }

        /**
         * Set the password. Required. Cannot be null.
         *
         * @param value The password.
         * @return This {@link Builder} instance.
         */
        public Builder setPassword(final String value) {
            _password = value;
            return this;
        }

        /**
         * Set the minimum pool size. Optional. Defaults to 1.
         *
         * @param value The minimum number of connections.
         * @return This {@link Builder} instance.
         */
        public Builder setMinimumConnections(final Integer value) {
            _minimumConnections = value;
            return this;
        }

        /**
         * Set the maximum pool size. Optional. Defaults to 10.
         *
         * @param value The maximum number of connections.
         * @return This {@link Builder} instance.
         */
        public Builder setMaximumConnections(final Integer value) {
            _maximumConnections = value;
            return this;
        }

        /**
         * Set whether to create the schema on startup. Optional. Defaults to false.
         *
         * @param value Whether to run the generated DDL.
         * @return This {@link Builder} instance.
         */
        public Builder setRunDdl(final Boolean value) {
            _runDdl = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _jdbcUrl;
        @NotNull
        @NotEmpty
        private String _driverName;
        @NotNull
        private String _username;
        @NotNull
        private String _password;
        @NotNull
        @Min(1)
        private Integer _minimumConnections = 1;
        @NotNull
        @Min(1)
        private Integer _maximumConnections = 10;
        @NotNull
        private Boolean _runDdl = false;
    }
}

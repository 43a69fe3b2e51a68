/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.eventbridge.eventsourcing.store;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.exception.EventStoreException;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;

/**
 * Applies the event store schema with Flyway before the R2DBC store is used.
 * <p>
 * Flyway talks JDBC, so the migrator is configured with the JDBC url of the same
 * database the R2DBC connection factory points at. The history is kept in its own
 * table so the library's migrations never interleave with the application's.
 */
@Slf4j
public class EventStoreMigrator {

    public static final String DEFAULT_LOCATION = "classpath:db/eventbridge";
    public static final String DEFAULT_HISTORY_TABLE = "eventbridge_schema_history";

    private final Flyway flyway;

    public EventStoreMigrator(String jdbcUrl, String username, String password) {
        this(Flyway.configure()
                .dataSource(jdbcUrl, username, password)
                .locations(DEFAULT_LOCATION)
                .table(DEFAULT_HISTORY_TABLE)
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load());
    }

    EventStoreMigrator(Flyway flyway) {
        this.flyway = flyway;
    }

    /**
     * Migrates the schema to the latest version.
     *
     * @return the number of migrations applied by this call
     * @throws EventStoreException if a migration fails
     */
    public int migrate() {
        try {
            MigrateResult result = flyway.migrate();
            log.info("Event store schema migrated: applied={}, version={}",
                    result.migrationsExecuted, result.targetSchemaVersion);
            return result.migrationsExecuted;
        } catch (FlywayException e) {
            throw new EventStoreException("Failed to migrate the event store schema", e);
        }
    }
}

package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL-specific ordering task store. */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresOrderingTaskRepository extends JdbcOrderingTaskRepository {

    public PostgresOrderingTaskRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO ordering_task
                (pk, sk, version, state, callback_token, signal_type, signal_payload, error, deadline,
                 created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (pk, sk, version) DO NOTHING
                """;
    }
}

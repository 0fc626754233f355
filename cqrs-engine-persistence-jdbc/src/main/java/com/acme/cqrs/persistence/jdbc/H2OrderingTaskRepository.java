package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific ordering task store; a duplicate task insert surfaces as a unique violation. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2OrderingTaskRepository extends JdbcOrderingTaskRepository {

    public H2OrderingTaskRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO ordering_task
                (pk, sk, version, state, callback_token, signal_type, signal_payload, error, deadline,
                 created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }
}

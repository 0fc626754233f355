package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.persistence.jdbc.mapper.CommandRecordMapper;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * H2-specific commands store. An insert over an existing key fails with a unique violation, which
 * the base class reports as a lost condition.
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2CommandRepository extends JdbcCommandRepository {

    public H2CommandRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return "INSERT INTO command_record (" + CommandRecordMapper.COLUMNS + """
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }
}

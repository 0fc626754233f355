package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.persistence.jdbc.mapper.CommandRecordMapper;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific commands store. {@code ON CONFLICT DO NOTHING} keeps a lost insert from
 * aborting the surrounding transaction; attributes are stored as JSONB.
 */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresCommandRepository extends JdbcCommandRepository {

    public PostgresCommandRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return "INSERT INTO command_record (" + CommandRecordMapper.COLUMNS + """
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (pk, sk) DO NOTHING
                """;
    }
}

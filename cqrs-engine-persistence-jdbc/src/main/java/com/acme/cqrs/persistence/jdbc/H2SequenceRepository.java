package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific counter store; the base UPDATE-then-INSERT increment applies unchanged. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2SequenceRepository extends JdbcSequenceRepository {

    public H2SequenceRepository(DataSource dataSource) {
        super(dataSource);
    }
}

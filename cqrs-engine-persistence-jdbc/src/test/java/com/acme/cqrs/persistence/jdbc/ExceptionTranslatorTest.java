package com.acme.cqrs.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.cqrs.core.PermanentException;
import com.acme.cqrs.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ExceptionTranslatorTest {

    private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("connection failures are transient")
        void testConnectionFailure() {
            RuntimeException result = ExceptionTranslator.translateException(
                    new SQLException("Connection refused to host", "08001"), "connect", logger);

            assertThat(result).isInstanceOf(TransientException.class);
            assertThat(result.getMessage()).contains("connect");
        }

        @Test
        @DisplayName("serialization failures are transient")
        void testSerializationFailure() {
            RuntimeException result = ExceptionTranslator.translateException(
                    new SQLException("could not serialize access", "40001"), "update", logger);

            assertThat(result).isInstanceOf(TransientException.class);
        }

        @Test
        @DisplayName("H2 lock timeouts are transient")
        void testH2LockTimeout() {
            RuntimeException result = ExceptionTranslator.translateException(
                    new SQLException("lock wait", "HYT00", 50200), "update", logger);

            assertThat(result).isInstanceOf(TransientException.class);
        }

        @Test
        @DisplayName("syntax errors are permanent")
        void testSyntaxError() {
            RuntimeException result = ExceptionTranslator.translateException(
                    new SQLException("bad statement", "42601"), "query", logger);

            assertThat(result).isInstanceOf(PermanentException.class);
            assertThat(result.getCause()).isInstanceOf(SQLException.class);
        }

        @Test
        @DisplayName("unclassified errors are retried")
        void testUnknownIsTransient() {
            RuntimeException result = ExceptionTranslator.translateException(
                    new SQLException("odd", "XX999"), "query", logger);

            assertThat(result).isInstanceOf(TransientException.class);
        }
    }

    @Nested
    @DisplayName("Unique violations")
    class UniqueViolationTests {

        @Test
        @DisplayName("SQLState 23505 is a unique violation")
        void testSqlState() {
            assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("dup", "23505"))).isTrue();
        }

        @Test
        @DisplayName("a chained 23505 is found")
        void testChained() {
            SQLException batch = new SQLException("batch failed", "XX000");
            batch.setNextException(new SQLException("dup", "23505"));

            assertThat(ExceptionTranslator.isUniqueViolation(batch)).isTrue();
        }

        @Test
        @DisplayName("other integrity errors are not unique violations")
        void testNotNullViolation() {
            assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("null", "23502"))).isFalse();
        }
    }
}

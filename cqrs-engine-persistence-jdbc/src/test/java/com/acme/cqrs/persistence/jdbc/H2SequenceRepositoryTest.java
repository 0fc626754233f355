package com.acme.cqrs.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class H2SequenceRepositoryTest extends H2RepositoryTestBase {

    private static final String SCOPE = "SEQ#ACME#invoice";

    private H2SequenceRepository repository;

    @BeforeEach
    void setUp() {
        repository = new H2SequenceRepository(dataSource);
    }

    @Test
    @DisplayName("a missing counter reads as zero and starts at one")
    void testFirstIncrement() {
        assertThat(repository.current(SCOPE, "none")).isZero();
        assertThat(repository.increment(SCOPE, "none", 1)).isEqualTo(1);
        assertThat(repository.increment(SCOPE, "none", 1)).isEqualTo(2);
        assertThat(repository.current(SCOPE, "none")).isEqualTo(2);
    }

    @Test
    @DisplayName("each period keeps its own counter")
    void testPeriodsAreIndependent() {
        repository.increment(SCOPE, "202405", 1);
        repository.increment(SCOPE, "202405", 1);

        assertThat(repository.increment(SCOPE, "202406", 1)).isEqualTo(1);
        assertThat(repository.current(SCOPE, "202405")).isEqualTo(2);
    }

    @Test
    @DisplayName("concurrent increments should hand out every value exactly once")
    void testConcurrentIncrementsAreContiguous() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Long> values = new ArrayList<>();
        try {
            List<Callable<Long>> callers = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                callers.add(() -> repository.increment(SCOPE, "none", 1));
            }
            for (Future<Long> value : pool.invokeAll(callers)) {
                values.add(value.get());
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(values).doesNotHaveDuplicates().hasSize(100);
        assertThat(values).allMatch(v -> v >= 1 && v <= 100);
    }
}

package com.acme.cqrs.repository.memory;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import com.acme.cqrs.stream.ChangeEventType;
import com.acme.cqrs.stream.ChangeStreamEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryCommandRepositoryTest {

  private static final AggregateKey KEY = AggregateKey.of("PRODUCT#ACME", "p1");

  private InMemoryCommandRepository repository;

  @BeforeEach
  void setUp() {
    repository = new InMemoryCommandRepository();
  }

  private CommandRecord version(AggregateKey key, int v) {
    return CommandRecord.builder()
        .partitionKey(key.partitionKey())
        .sortKey(key.versionedSortKey(v))
        .version(v)
        .status(CommandStatus.PENDING)
        .build();
  }

  @Test
  @DisplayName("should refuse a second record for the same version")
  void testConditionalInsert() {
    assertThat(repository.insertIfAbsent(version(KEY, 0))).isTrue();
    assertThat(repository.insertIfAbsent(version(KEY, 0))).isFalse();
    assertThat(repository.findVersions(KEY)).hasSize(1);
  }

  @Test
  @DisplayName("should find the latest version and a specific one")
  void testFind() {
    repository.insertIfAbsent(version(KEY, 0));
    repository.insertIfAbsent(version(KEY, 1));

    assertThat(repository.findLatest(KEY)).map(CommandRecord::getVersion).hasValue(1);
    assertThat(repository.find(KEY.atVersion(0))).isPresent();
    assertThat(repository.find(KEY.atVersion(5))).isEmpty();
    assertThat(repository.findLatest(AggregateKey.of("PRODUCT#ACME", "none"))).isEmpty();
  }

  @Test
  @DisplayName("should query a partition by versioned sort-key prefix in either order")
  void testQuery() {
    repository.insertIfAbsent(version(KEY, 0));
    repository.insertIfAbsent(version(KEY, 1));
    repository.insertIfAbsent(version(AggregateKey.of("PRODUCT#ACME", "p2"), 0));

    assertThat(repository.queryByPartition("PRODUCT#ACME", SortKeyFilter.beginsWith("p1@"), 10, QueryOrder.DESC))
        .extracting(CommandRecord::getSortKey)
        .containsExactly("p1@1", "p1@0");
  }

  @Test
  @DisplayName("should change only status and token, and log the change")
  void testUpdateStatus() {
    repository.insertIfAbsent(version(KEY, 0));

    assertThat(repository.updateStatus(KEY.atVersion(0), CommandStatus.WAITING, "tok")).isTrue();
    assertThat(repository.updateStatus(KEY.atVersion(9), CommandStatus.WAITING, "tok")).isFalse();

    assertThat(repository.find(KEY.atVersion(0)))
        .hasValueSatisfying(
            r -> {
              assertThat(r.getStatus()).isEqualTo(CommandStatus.WAITING);
              assertThat(r.getCallbackToken()).isEqualTo("tok");
            });
    assertThat(repository.poll(10))
        .extracting(e -> e.event().eventType())
        .containsExactly(ChangeEventType.INSERT);
  }

  @Test
  @DisplayName("should redeliver unacknowledged entries")
  void testAcknowledge() {
    repository.insertIfAbsent(version(KEY, 0));
    repository.insertIfAbsent(version(KEY, 1));
    ChangeStreamEntry first = repository.poll(1).get(0);

    repository.acknowledge(first.id());

    assertThat(repository.poll(10)).singleElement().satisfies(e -> assertThat(e.event().newRecord().getVersion()).isEqualTo(1));
  }
}

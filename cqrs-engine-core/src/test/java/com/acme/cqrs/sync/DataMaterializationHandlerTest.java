package com.acme.cqrs.sync;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.repository.memory.InMemoryCommandRepository;
import com.acme.cqrs.repository.memory.InMemoryDataRepository;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DataMaterializationHandlerTest {

  private static final AggregateKey KEY = AggregateKey.of("PRODUCT#ACME", "p1");

  private InMemoryDataRepository data;
  private InMemoryCommandRepository commands;
  private DataMaterializationHandler handler;

  @BeforeEach
  void setUp() {
    data = new InMemoryDataRepository();
    commands = new InMemoryCommandRepository();
    handler = new DataMaterializationHandler(data, commands);
  }

  private CommandRecord version(int v, String color, Instant at) {
    CommandRecord record =
        CommandRecord.builder()
            .partitionKey(KEY.partitionKey())
            .sortKey(KEY.versionedSortKey(v))
            .version(v)
            .tenantCode("ACME")
            .entityType("product")
            .attributes(Map.of("color", color))
            .createdAt(at)
            .createdBy("creator-" + v)
            .updatedAt(at)
            .build();
    commands.insertIfAbsent(record);
    return record;
  }

  @Test
  @DisplayName("should write the command's state under the unversioned key")
  void testUp() {
    DataRecord result = handler.up(version(0, "red", Instant.parse("2024-01-01T00:00:00Z")));

    assertThat(result.getSortKey()).isEqualTo("p1");
    assertThat(result.getCommandSortKey()).isEqualTo("p1@0");
    assertThat(data.find(KEY)).hasValue(result);
  }

  @Test
  @DisplayName("should keep the creation audit fields of the first version")
  void testKeepsCreation() {
    handler.up(version(0, "red", Instant.parse("2024-01-01T00:00:00Z")));

    DataRecord v1 = handler.up(version(1, "blue", Instant.parse("2024-02-01T00:00:00Z")));

    assertThat(v1.getCreatedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(v1.getCreatedBy()).isEqualTo("creator-0");
    assertThat(v1.getUpdatedAt()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
  }

  @Test
  @DisplayName("should not overwrite a newer version with a redelivered older one")
  void testStaleRedelivery() {
    CommandRecord v0 = version(0, "red", Instant.now());
    handler.up(v0);
    handler.up(version(1, "blue", Instant.now()));

    DataRecord result = handler.up(v0);

    assertThat(result.getVersion()).isEqualTo(1);
    assertThat(data.find(KEY).orElseThrow().getAttributes()).containsEntry("color", "blue");
  }

  @Test
  @DisplayName("should restore the previous version on rollback")
  void testDown() {
    handler.up(version(0, "red", Instant.now()));
    CommandRecord v1 = version(1, "blue", Instant.now());
    handler.up(v1);

    DataRecord restored = handler.down(v1);

    assertThat(restored.getVersion()).isZero();
    assertThat(data.find(KEY).orElseThrow().getAttributes()).containsEntry("color", "red");
  }

  @Test
  @DisplayName("should mark the record deleted when rolling back the first version")
  void testDownFirstVersion() {
    CommandRecord v0 = version(0, "red", Instant.now());
    handler.up(v0);

    assertThat(handler.down(v0).isDeleted()).isTrue();
  }
}

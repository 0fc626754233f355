package com.acme.cqrs.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.acme.cqrs.command.CommandProcessor;
import com.acme.cqrs.data.DataService;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandInput;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.domain.InvocationContext;
import com.acme.cqrs.ordering.BaseOrderingOrchestrator;
import com.acme.cqrs.ordering.OrderingState;
import com.acme.cqrs.persistence.jdbc.H2CommandRepository;
import com.acme.cqrs.persistence.jdbc.H2SequenceRepository;
import com.acme.cqrs.processor.config.SchemaMigrator;
import com.acme.cqrs.processor.ordering.OrderingOrchestrator;
import com.acme.cqrs.processor.ordering.TimeoutSweeper;
import com.acme.cqrs.processor.stream.ChangeStreamSweeper;
import com.acme.cqrs.processor.sync.AuditLogSyncHandler;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.SequenceRepository;
import com.acme.cqrs.sequence.SequenceGenerator;
import com.acme.cqrs.sequence.SequenceRequest;
import com.acme.cqrs.sequence.SequenceResult;
import com.acme.cqrs.stream.ChangeStreamDispatcher;
import com.acme.cqrs.sync.SyncHandlerRegistry;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Processor context over H2")
class ProcessorContextIntegrationTest extends ProcessorIntegrationTestBase {

  private static final String PK = "PRODUCT#ACME";
  private static final InvocationContext CONTEXT =
      new InvocationContext("user-1", "10.0.0.1", "req-1", "integration");

  @Override
  protected Map<String, Object> additionalProperties() {
    return Map.of("sync.audit-log.enabled", "true");
  }

  private static CommandInput product(String sortKey, int version, int price) {
    return CommandInput.builder()
        .partitionKey(PK)
        .sortKey(sortKey)
        .version(version)
        .entityId(sortKey)
        .tenantCode("ACME")
        .entityType("product")
        .displayName("Product " + sortKey)
        .attributes(Map.of("price", price))
        .build();
  }

  @Nested
  @DisplayName("Wiring")
  class WiringTests {

    @Test
    @DisplayName("H2 dialect selects the JDBC stores and the transactional orchestrator")
    void testDialectWiring() {
      assertThat(context.getBean(CommandRepository.class)).isInstanceOf(H2CommandRepository.class);
      assertThat(context.getBean(SequenceRepository.class)).isInstanceOf(H2SequenceRepository.class);
      assertThat(context.getBean(BaseOrderingOrchestrator.class))
          .isInstanceOf(OrderingOrchestrator.class);
    }

    @Test
    @DisplayName("the schema is migrated at startup")
    void testSchemaMigrated() {
      assertThat(context.getBean(SchemaMigrator.class).getResult().success).isTrue();
    }

    @Test
    @DisplayName("enabled sync handlers are registered")
    void testHandlersRegistered() {
      SyncHandlerRegistry registry = context.getBean(SyncHandlerRegistry.class);

      assertThat(registry.size()).isEqualTo(1);
      assertThat(registry.handlersFor("product").get(0)).isInstanceOf(AuditLogSyncHandler.class);
    }

    @Test
    @DisplayName("sweepers are absent when disabled")
    void testSweepersDisabled() {
      assertThat(context.containsBean(ChangeStreamSweeper.class)).isFalse();
      assertThat(context.containsBean(TimeoutSweeper.class)).isFalse();
    }
  }

  @Nested
  @DisplayName("Publication")
  class PublicationTests {

    @Test
    @DisplayName("synchronous publication completes and materializes the data record")
    void testPublishSync() {
      CommandProcessor processor = context.getBean(CommandProcessor.class);

      CommandRecord record = processor.publishSync(product("SKU-SYNC", CommandInput.VERSION_NEW, 5), CONTEXT);

      assertThat(record.getStatus()).isEqualTo(CommandStatus.COMPLETED);
      DataRecord data =
          context.getBean(DataService.class).getItem(AggregateKey.of(PK, "SKU-SYNC")).orElseThrow();
      assertThat(data.getVersion()).isZero();
      assertThat(data.getAttributes()).containsEntry("price", 5);
    }

    @Test
    @DisplayName("asynchronous versions materialize in order once the change stream is drained")
    void testPublishAsync() {
      CommandProcessor processor = context.getBean(CommandProcessor.class);
      BaseOrderingOrchestrator orchestrator = context.getBean(BaseOrderingOrchestrator.class);
      AggregateKey key = AggregateKey.of(PK, "SKU-ASYNC");

      processor.publishAsync(product("SKU-ASYNC", CommandInput.VERSION_NEW, 10), CONTEXT);
      processor.publishAsync(product("SKU-ASYNC", 0, 11), CONTEXT);
      processor.publishAsync(product("SKU-ASYNC", CommandInput.VERSION_LATEST, 12), CONTEXT);

      assertThat(context.getBean(ChangeStreamDispatcher.class).drain(100)).isGreaterThanOrEqualTo(3);

      await()
          .atMost(Duration.ofSeconds(10))
          .until(
              () ->
                  orchestrator
                      .findTask(key, 2)
                      .map(t -> t.state() == OrderingState.IDLE)
                      .orElse(false));
      DataRecord data = context.getBean(DataService.class).getItem(key).orElseThrow();
      assertThat(data.getVersion()).isEqualTo(2);
      assertThat(data.getAttributes()).containsEntry("price", 12);
      assertThat(context.getBean(DataService.class).listHistory(key))
          .extracting(CommandRecord::getStatus)
          .containsOnly(CommandStatus.COMPLETED);
    }
  }

  @Nested
  @DisplayName("Sequences")
  class SequenceTests {

    @Test
    @DisplayName("configured sequence types format with their fiscal year")
    void testConfiguredInvoiceSequence() {
      SequenceGenerator generator = context.getBean(SequenceGenerator.class);
      SequenceRequest request =
          SequenceRequest.builder()
              .tenantCode("ACME")
              .typeCode("invoice")
              .date(LocalDate.of(2024, 5, 1))
              .build();

      SequenceResult first = generator.generate(request);
      SequenceResult second = generator.generate(request);

      assertThat(first.formattedNo()).isEqualTo("INV-2024-000001");
      assertThat(second.no()).isEqualTo(2);
    }
  }
}

package com.acme.cqrs.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.cqrs.config.ProcessingConfig;
import com.acme.cqrs.core.HandlerFailureException;
import com.acme.cqrs.core.NotFoundException;
import com.acme.cqrs.domain.CommandRecord;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChangeNotifierTest {

  private SyncHandlerRegistry registry;
  private DataMaterializationHandler materializer;
  private ProcessingConfig config;
  private ChangeNotifier notifier;

  private final CommandRecord record =
      CommandRecord.builder()
          .partitionKey("PRODUCT#ACME")
          .sortKey("p1@2")
          .version(2)
          .tenantCode("ACME")
          .entityType("product")
          .attributes(Map.of("color", "red"))
          .build();

  @BeforeEach
  void setUp() {
    registry = new SyncHandlerRegistry();
    materializer = mock(DataMaterializationHandler.class);
    when(materializer.name()).thenReturn("DataMaterializationHandler");
    config = new ProcessingConfig();
    notifier = new ChangeNotifier(registry, materializer, config);
  }

  @Nested
  @DisplayName("materialize")
  class MaterializeTests {

    @Test
    @DisplayName("should run the default handler")
    void testMaterialize() {
      notifier.materialize(record);

      verify(materializer).up(record);
    }

    @Test
    @DisplayName("should skip the default handler when disabled")
    void testDisabled() {
      config.setDisableDefaultHandler(true);

      notifier.materialize(record);

      verify(materializer, never()).up(any());
    }

    @Test
    @DisplayName("should propagate materialization errors")
    void testPropagates() {
      when(materializer.up(record)).thenThrow(new IllegalStateException("db down"));

      assertThatThrownBy(() -> notifier.materialize(record)).hasMessage("db down");
    }
  }

  @Nested
  @DisplayName("notifyHandlers")
  class NotifyTests {

    @Test
    @DisplayName("should invoke every matching handler and isolate failures")
    void testIsolation() {
      SyncHandler failing = mock(SyncHandler.class);
      when(failing.name()).thenReturn("failing");
      when(failing.up(record)).thenThrow(new IllegalStateException("sink down"));
      SyncHandler ok = mock(SyncHandler.class);
      when(ok.name()).thenReturn("ok");
      when(ok.up(record)).thenReturn("indexed");
      SyncHandler other = mock(SyncHandler.class);
      when(other.name()).thenReturn("other");
      registry.register("product", failing);
      registry.register("product", ok);
      registry.register("order", other);

      List<SyncResult> results = notifier.notifyHandlers(record);

      assertThat(results).extracting(SyncResult::handlerName).containsExactly("failing", "ok");
      assertThat(results.get(0).isSuccess()).isFalse();
      assertThat(results.get(0).error())
          .isInstanceOf(HandlerFailureException.class)
          .hasRootCauseMessage("sink down");
      assertThat(results.get(1).result()).isEqualTo("indexed");
      verify(other, never()).up(any());
    }

    @Test
    @DisplayName("should return no results without handlers")
    void testNoHandlers() {
      assertThat(notifier.notifyHandlers(record)).isEmpty();
    }
  }

  @Nested
  @DisplayName("rollback")
  class RollbackTests {

    @Test
    @DisplayName("should call down on the named handler only")
    void testRollback() {
      SyncHandler search = mock(SyncHandler.class);
      when(search.name()).thenReturn("search");
      when(search.down(record)).thenReturn("removed");
      registry.register("product", search);

      assertThat(notifier.rollback("search", record)).isEqualTo("removed");
      verify(materializer, never()).down(any());
    }

    @Test
    @DisplayName("should address the default handler by name")
    void testRollbackDefault() {
      notifier.rollback("DataMaterializationHandler", record);

      verify(materializer).down(record);
    }

    @Test
    @DisplayName("should reject an unknown handler")
    void testUnknown() {
      assertThatThrownBy(() -> notifier.rollback("nope", record))
          .isInstanceOf(NotFoundException.class);
    }
  }
}

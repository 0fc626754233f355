package com.acme.cqrs.data;

import static com.acme.cqrs.support.TestEngine.CONTEXT;
import static com.acme.cqrs.support.TestEngine.PARTITION_KEY;
import static com.acme.cqrs.support.TestEngine.newProduct;
import static com.acme.cqrs.support.TestEngine.product;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.cqrs.core.ValidationException;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import com.acme.cqrs.support.TestEngine;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DataServiceTest {

  private TestEngine engine;
  private DataService service;

  @BeforeEach
  void setUp() {
    engine = new TestEngine();
    service = engine.dataService;
    engine.processor.publishSync(newProduct("item-1", Map.of("n", 1)), CONTEXT);
    engine.processor.publishSync(product("item-1", 0, Map.of("n", 2)), CONTEXT);
    engine.processor.publishSync(newProduct("item-2", Map.of("n", 1)), CONTEXT);
    engine.processor.publishSync(newProduct("other-1", Map.of("n", 1)), CONTEXT);
  }

  @Test
  @DisplayName("should return the latest materialized state")
  void testGetItem() {
    assertThat(service.getItem(AggregateKey.of(PARTITION_KEY, "item-1")))
        .hasValueSatisfying(
            d -> {
              assertThat(d.getVersion()).isEqualTo(1);
              assertThat(d.getAttributes()).containsEntry("n", 2);
            });
    assertThat(service.getItem(AggregateKey.of(PARTITION_KEY, "missing"))).isEmpty();
  }

  @Test
  @DisplayName("should list a partition with a prefix filter and order")
  void testListByPk() {
    assertThat(service.listItemsByPk(PARTITION_KEY)).hasSize(3);
    assertThat(service.listItemsByPk(PARTITION_KEY, SortKeyFilter.beginsWith("item-"), 10, QueryOrder.DESC))
        .extracting(DataRecord::getSortKey)
        .containsExactly("item-2", "item-1");
    assertThat(service.listItemsByPk(PARTITION_KEY, SortKeyFilter.any(), 1, QueryOrder.ASC))
        .extracting(DataRecord::getSortKey)
        .containsExactly("item-1");
  }

  @Test
  @DisplayName("should reject an empty partition key or limit")
  void testListValidation() {
    assertThatThrownBy(() -> service.listItemsByPk(" ")).isInstanceOf(ValidationException.class);
    assertThatThrownBy(
            () -> service.listItemsByPk(PARTITION_KEY, SortKeyFilter.any(), 0, QueryOrder.ASC))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  @DisplayName("should list every version of an aggregate oldest first")
  void testHistory() {
    assertThat(service.listHistory(AggregateKey.of(PARTITION_KEY, "item-1")))
        .extracting(CommandRecord::getSortKey)
        .containsExactly("item-1@0", "item-1@1");
  }
}

package com.acme.cqrs.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JsonsTest {

  @Test
  @DisplayName("should merge a patch over a base map")
  void testMerge() {
    assertThat(Jsons.merge(Map.of("a", 1, "b", 2), Map.of("b", 3, "c", 4)))
        .containsExactlyInAnyOrderEntriesOf(Map.of("a", 1, "b", 3, "c", 4));
    assertThat(Jsons.merge(null, Map.of("a", 1))).containsEntry("a", 1);
  }

  @Test
  @DisplayName("should compare content regardless of numeric type and key order")
  void testSameContent() {
    assertThat(Jsons.sameContent(Map.of("n", 1, "s", "x"), Map.of("s", "x", "n", 1L))).isTrue();
    assertThat(Jsons.sameContent(Map.of("n", 1), Map.of("n", 2))).isFalse();
    assertThat(Jsons.sameContent(null, null)).isTrue();
    assertThat(Jsons.sameContent(Map.of(), null)).isFalse();
  }

  @Test
  @DisplayName("should parse blank text as an empty map")
  void testToMap() {
    assertThat(Jsons.toMap(null)).isEmpty();
    assertThat(Jsons.toMap("{\"a\":{\"b\":1}}")).containsKey("a");
    assertThatThrownBy(() -> Jsons.toMap("not json")).isInstanceOf(PermanentException.class);
  }
}

package io.incentedge.webhooks.filter;

import io.incentedge.webhooks.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterCriteriaTest {
  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void parsesSnakeCaseJson() {
    FilterCriteria criteria = codec.fromJson(
        "{\"project_ids\":[\"p1\"],\"states\":[\"CA\",\"NY\"],\"min_value\":10000,\"max_value\":2.5E5}",
        FilterCriteria.class);

    assertEquals(List.of("p1"), criteria.projectIds());
    assertEquals(List.of("CA", "NY"), criteria.states());
    assertEquals(0, new BigDecimal("10000").compareTo(criteria.minValue()));
    assertEquals(0, new BigDecimal("250000").compareTo(criteria.maxValue()));
    assertTrue(criteria.sectors().isEmpty());
  }

  @Test
  void unknownKeysIgnored() {
    FilterCriteria criteria = codec.fromJson("{\"colour\":\"blue\"}", FilterCriteria.class);

    assertTrue(criteria.isEmpty());
  }

  @Test
  void emptyDimensionsOmittedWhenWritten() {
    String json = codec.toJson(FilterCriteria.builder().sectors("solar").build());

    assertEquals("{\"sectors\":[\"solar\"]}", json);
    assertEquals("{}", codec.toJson(FilterCriteria.EMPTY));
  }

  @Test
  void invertedRangeRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> FilterCriteria.builder().minValue(10).maxValue(5).build());
    assertThrows(IllegalArgumentException.class,
        () -> codec.fromJson("{\"min_value\":10,\"max_value\":5}", FilterCriteria.class));
  }

  @Test
  void listsAreCopied() {
    List<String> ids = new ArrayList<>(List.of("p1"));
    FilterCriteria criteria = new FilterCriteria(ids, null, null, null, null, null, null, null);

    ids.add("p2");

    assertEquals(List.of("p1"), criteria.projectIds());
    assertThrows(UnsupportedOperationException.class, () -> criteria.projectIds().add("p3"));
  }
}

package io.incentedge.webhooks.filter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Evaluates {@link FilterCriteria} against an event's {@code data} object.
 *
 * <p>List dimensions fail closed: when a list is populated and the event lacks the
 * corresponding field, the event does not match. The value dimension fails open: when no
 * value-bearing field is present, the bounds are not checked.
 */
public final class EventFilter {
  /** Fields consulted for the value range, first present wins. */
  static final List<String> VALUE_FIELDS =
      List.of("estimated_value", "amount_requested", "total_potential_value");

  private EventFilter() {}

  /**
   * Returns whether the event data satisfies every populated dimension of the criteria.
   *
   * @param data     the envelope's data object
   * @param criteria the subscription's filters; {@code null} or empty matches everything
   * @return {@code true} if the event should be delivered
   */
  public static boolean matches(Map<String, ?> data, FilterCriteria criteria) {
    if (criteria == null || criteria.isEmpty()) {
      return true;
    }
    Map<String, ?> fields = data == null ? Map.of() : data;
    return contains(criteria.projectIds(), fields.get("project_id"))
        && contains(criteria.applicationIds(), fields.get("application_id"))
        && contains(criteria.incentiveProgramIds(), fields.get("incentive_program_id"))
        && contains(criteria.statuses(), firstNonNull(fields.get("current_status"), fields.get("status")))
        && contains(criteria.sectors(), fields.get("sector"))
        && contains(criteria.states(), fields.get("state"))
        && withinRange(fields, criteria.minValue(), criteria.maxValue());
  }

  private static boolean contains(List<String> allowed, Object value) {
    if (allowed.isEmpty()) {
      return true;
    }
    return value != null && allowed.contains(String.valueOf(value));
  }

  private static boolean withinRange(Map<String, ?> fields, BigDecimal min, BigDecimal max) {
    if (min == null && max == null) {
      return true;
    }
    BigDecimal value = firstValue(fields);
    if (value == null) {
      return true;
    }
    if (min != null && value.compareTo(min) < 0) {
      return false;
    }
    return max == null || value.compareTo(max) <= 0;
  }

  private static BigDecimal firstValue(Map<String, ?> fields) {
    for (String name : VALUE_FIELDS) {
      BigDecimal value = toDecimal(fields.get(name));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  static BigDecimal toDecimal(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return null;
      }
      try {
        return new BigDecimal(number.toString());
      } catch (NumberFormatException e) {
        return BigDecimal.valueOf(d);
      }
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return new BigDecimal(text.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Object firstNonNull(Object first, Object second) {
    return first != null ? first : second;
  }
}

package io.incentedge.webhooks.delivery;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryHeadersTest {
  private final DeliveryHeaders headers = new DeliveryHeaders(DeliveryHeaders.DEFAULT_PRODUCT_NAME);

  @Test
  void protocolHeaderNames() {
    assertEquals("IncentEdge-Webhook/1.0", headers.userAgent());
    assertEquals("X-IncentEdge-Signature", headers.signatureHeader());
    assertEquals("X-IncentEdge-Event", headers.eventHeader());
    assertEquals("X-IncentEdge-Delivery", headers.deliveryHeader());
  }

  @Test
  void customHeadersComeFirstAndCannotOverrideProtocol() {
    Map<String, String> custom = new LinkedHashMap<>();
    custom.put("Authorization", "Bearer abc");
    custom.put("x-incentedge-signature", "forged");
    custom.put("content-type", "text/plain");

    Map<String, String> built = headers.build(custom, "t=1,v1=ab", "project.created", "evt_1");

    assertEquals(List.of("Authorization", "Content-Type", "User-Agent", "X-IncentEdge-Signature",
        "X-IncentEdge-Event", "X-IncentEdge-Delivery"), List.copyOf(built.keySet()));
    assertEquals("t=1,v1=ab", built.get("X-IncentEdge-Signature"));
    assertEquals("application/json", built.get("Content-Type"));
    assertEquals("evt_1", built.get("X-IncentEdge-Delivery"));
  }

  @Test
  void nullCustomHeadersAllowed() {
    Map<String, String> built = headers.build(null, "sig", "project.created", "evt_1");

    assertEquals(5, built.size());
    assertThrows(UnsupportedOperationException.class, () -> built.put("X", "y"));
  }

  @Test
  void productNameMustBeHeaderToken() {
    assertEquals("X-Acme-Event", new DeliveryHeaders("Acme").eventHeader());
    assertThrows(IllegalArgumentException.class, () -> new DeliveryHeaders("Acme Corp"));
    assertThrows(IllegalArgumentException.class, () -> new DeliveryHeaders(""));
    assertThrows(NullPointerException.class, () -> new DeliveryHeaders(null));
  }
}

package com.gentoro.onegraph.service;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.NullNode;
import com.gentoro.onegraph.exception.FetchException;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

public class ServiceRegistryTest {

  private static final ServiceEndpoint NOOP =
      request -> CompletableFuture.completedFuture(GraphqlResponse.ofData(NullNode.getInstance()));

  @Test
  void registersAndLooksUpInOrder() {
    ServiceRegistry registry = new ServiceRegistry().register("users", NOOP).register("posts", NOOP);

    assertTrue(registry.contains("users"));
    assertFalse(registry.contains("comments"));
    assertSame(NOOP, registry.lookup("posts"));
    assertEquals(List.of("users", "posts"), List.copyOf(registry.names()));
    assertThrows(UnsupportedOperationException.class, () -> registry.names().clear());
  }

  @Test
  void unknownServiceLookupFails() {
    FetchException e =
        assertThrows(FetchException.class, () -> new ServiceRegistry().lookup("comments"));
    assertEquals(FetchException.Kind.UNKNOWN_SERVICE, e.getKind());
    assertEquals("comments", e.getService());
  }

  @Test
  void rejectsInvalidRegistrations() {
    ServiceRegistry registry = new ServiceRegistry();
    assertThrows(IllegalArgumentException.class, () -> registry.register("", NOOP));
    assertThrows(IllegalArgumentException.class, () -> registry.register("users", null));
  }
}

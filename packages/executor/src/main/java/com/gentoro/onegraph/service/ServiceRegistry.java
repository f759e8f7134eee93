package com.gentoro.onegraph.service;

import com.gentoro.onegraph.exception.FetchException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry of the services a plan may fetch from.
 *
 * <p>The typical lifecycle is:
 *
 * <ol>
 *   <li>Create a registry.
 *   <li>Register one endpoint per service name.
 *   <li>Hand it to the execution through {@link com.gentoro.onegraph.engine.ExecutionContext}.
 * </ol>
 *
 * The registry is read-only once execution starts.
 */
public class ServiceRegistry {

  private final Map<String, ServiceEndpoint> services = new LinkedHashMap<>();

  /**
   * Register a service.
   *
   * @param name name referenced by the {@code serviceName} of plan fetches
   * @param endpoint implementation used for calls to that service
   * @return this registry for fluent usage
   */
  public ServiceRegistry register(String name, ServiceEndpoint endpoint) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Service name must not be blank");
    }
    if (endpoint == null) {
      throw new IllegalArgumentException("Endpoint for service '" + name + "' must not be null");
    }
    services.put(name, endpoint);
    return this;
  }

  public boolean contains(String name) {
    return services.containsKey(name);
  }

  /**
   * Look up a previously registered service.
   *
   * @throws FetchException of kind {@code UNKNOWN_SERVICE} if nothing is registered under {@code
   *     name}
   */
  public ServiceEndpoint lookup(String name) {
    ServiceEndpoint endpoint = services.get(name);
    if (endpoint == null) {
      throw FetchException.unknownService(name);
    }
    return endpoint;
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(services.keySet());
  }
}

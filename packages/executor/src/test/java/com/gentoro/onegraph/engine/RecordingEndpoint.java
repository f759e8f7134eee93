package com.gentoro.onegraph.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.onegraph.graphql.GraphqlRequest;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import com.gentoro.onegraph.service.ServiceEndpoint;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** In-process service that records every request and answers through a handler. */
class RecordingEndpoint implements ServiceEndpoint {

  final List<GraphqlRequest> requests = new CopyOnWriteArrayList<>();
  private final Function<GraphqlRequest, CompletableFuture<GraphqlResponse>> handler;

  RecordingEndpoint(Function<GraphqlRequest, CompletableFuture<GraphqlResponse>> handler) {
    this.handler = handler;
  }

  static RecordingEndpoint respondingWith(String responseJson) {
    return new RecordingEndpoint(
        request -> {
          try {
            return CompletableFuture.completedFuture(GraphqlResponse.fromJson(responseJson));
          } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
          }
        });
  }

  static RecordingEndpoint failingWith(RuntimeException failure) {
    return new RecordingEndpoint(request -> CompletableFuture.failedFuture(failure));
  }

  @Override
  public CompletableFuture<GraphqlResponse> call(GraphqlRequest request) {
    requests.add(request);
    return handler.apply(request);
  }

  int calls() {
    return requests.size();
  }

  GraphqlRequest lastRequest() {
    return requests.get(requests.size() - 1);
  }
}

package com.gentoro.onegraph.service;

import com.gentoro.onegraph.graphql.GraphqlRequest;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import java.util.concurrent.CompletableFuture;

/**
 * A service that answers GraphQL requests.
 *
 * <p>Implementations complete the future with the decoded response, or exceptionally (preferably
 * with a {@link com.gentoro.onegraph.exception.FetchException}) when no response could be
 * obtained. The future must not be completed on the caller's thread while holding locks the
 * caller needs.
 */
@FunctionalInterface
public interface ServiceEndpoint {
  CompletableFuture<GraphqlResponse> call(GraphqlRequest request);
}

package com.gentoro.onegraph.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.onegraph.exception.FetchException;
import com.gentoro.onegraph.graphql.GraphqlRequest;
import com.gentoro.onegraph.graphql.GraphqlResponse;
import com.gentoro.onegraph.utility.JacksonUtility;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link ServiceEndpoint} that POSTs the request as JSON to a GraphQL HTTP endpoint.
 *
 * <p>Calls are asynchronous: the returned future completes on an OkHttp dispatcher thread.
 * Transport failures and non-2xx statuses fail the future with {@code SUBREQUEST_HTTP_ERROR}; a
 * body that is not a GraphQL response fails it with {@code MALFORMED_RESPONSE}.
 */
public class HttpServiceEndpoint implements ServiceEndpoint {
  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(HttpServiceEndpoint.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final String serviceName;
  private final HttpUrl url;
  private final OkHttpClient client;

  public HttpServiceEndpoint(String serviceName, String url, OkHttpClient client) {
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalArgumentException("Service name must not be blank");
    }
    HttpUrl parsed = url == null ? null : HttpUrl.parse(url);
    if (parsed == null) {
      throw new IllegalArgumentException(
          "Invalid URL for service '" + serviceName + "': " + url);
    }
    if (client == null) {
      throw new IllegalArgumentException("OkHttpClient cannot be null");
    }
    this.serviceName = serviceName;
    this.url = parsed;
    this.client = client;
  }

  public String getServiceName() {
    return serviceName;
  }

  public HttpUrl getUrl() {
    return url;
  }

  @Override
  public CompletableFuture<GraphqlResponse> call(GraphqlRequest graphqlRequest) {
    CompletableFuture<GraphqlResponse> result = new CompletableFuture<>();
    String payload;
    try {
      payload = JacksonUtility.getJsonMapper().writeValueAsString(graphqlRequest);
    } catch (JsonProcessingException e) {
      result.completeExceptionally(
          FetchException.httpError(serviceName, "could not serialize request", e));
      return result;
    }

    Request request =
        new Request.Builder()
            .url(url)
            .header("Accept", "application/json")
            .post(RequestBody.create(payload, JSON))
            .build();
    Call call = client.newCall(request);
    result.whenComplete(
        (r, t) -> {
          if (result.isCancelled()) {
            call.cancel();
          }
        });
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(Call c, IOException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result.completeExceptionally(FetchException.httpError(serviceName, reason, e));
          }

          @Override
          public void onResponse(Call c, Response response) {
            try (response) {
              result.complete(decode(response));
            } catch (FetchException e) {
              result.completeExceptionally(e);
            } catch (IOException e) {
              result.completeExceptionally(
                  FetchException.httpError(serviceName, "could not read response body", e));
            }
          }
        });
    return result;
  }

  private GraphqlResponse decode(Response response) throws IOException {
    if (!response.isSuccessful()) {
      log.warn("Service '{}' answered HTTP {}", serviceName, response.code());
      throw FetchException.httpError(
          serviceName, response.code(), "HTTP " + response.code(), null);
    }
    ResponseBody body = response.body();
    String text = body == null ? "" : body.string();
    if (text.isBlank()) {
      throw FetchException.malformedResponse(serviceName, "empty response body");
    }
    try {
      return GraphqlResponse.fromJson(text);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw FetchException.malformedResponse(serviceName, e.getMessage(), e);
    }
  }
}

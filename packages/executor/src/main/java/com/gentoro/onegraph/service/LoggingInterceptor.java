package com.gentoro.onegraph.service;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/** Logs every subgraph request and response; bodies only at DEBUG/TRACE. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.onegraph.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending request {} {}\nHeaders:\n{}\nBody:\n{}\n",
          request.method(),
          request.url(),
          request.headers(),
          bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "Received response for {} in {} ms\nStatus: {}\nHeaders:\n{}\n",
        response.request().url(),
        elapsedMs(startTime),
        response.code(),
        response.headers());
    if (log.isTraceEnabled()) {
      String responseBody = "";
      try {
        ResponseBody peeked = response.peekBody(Long.MAX_VALUE);
        responseBody = peeked.string();
      } catch (IOException e) {
        log.debug("Could not read response body", e);
      }
      log.trace("Response body:\n{}\n", responseBody.isEmpty() ? "[empty]" : responseBody);
    }
    return response;
  }

  private static long elapsedMs(long startTime) {
    return (System.nanoTime() - startTime) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}

package com.gentoro.onegraph.service;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class OkHttpFactory {

  public static final String CONNECT_TIMEOUT_KEY = "http.connect-timeout-seconds";
  public static final String READ_TIMEOUT_KEY = "http.read-timeout-seconds";

  public static OkHttpClient create(Configuration configuration) {
    long connectTimeout = configuration == null ? 10 : configuration.getLong(CONNECT_TIMEOUT_KEY, 10);
    long readTimeout = configuration == null ? 20 : configuration.getLong(READ_TIMEOUT_KEY, 20);
    return create(connectTimeout, readTimeout);
  }

  public static OkHttpClient create(long connectTimeoutSeconds, long readTimeoutSeconds) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
        .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}

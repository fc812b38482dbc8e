package com.fieldflow.tracker.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    if (connectTimeout == null || readTimeout == null) {
      throw new IllegalArgumentException("Timeouts cannot be null");
    }
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}

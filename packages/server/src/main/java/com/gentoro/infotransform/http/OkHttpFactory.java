package com.gentoro.infotransform.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  private OkHttpFactory() {}

  /**
   * Client for webhook delivery. {@code callTimeout} bounds one attempt end to end; retries are
   * the caller's concern, so OkHttp's own connection retry is disabled.
   */
  public static OkHttpClient create(Duration callTimeout, String signatureHeader) {
    return new OkHttpClient.Builder()
        .connectTimeout(callTimeout)
        .readTimeout(callTimeout)
        .callTimeout(callTimeout)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor(signatureHeader))
        .build();
  }
}

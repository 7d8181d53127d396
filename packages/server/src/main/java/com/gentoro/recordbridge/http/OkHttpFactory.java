package com.gentoro.recordbridge.http;

import com.gentoro.recordbridge.BackendSettings;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Build the client shared by the login exchange and every backend call. Extra interceptors run
   * after the defaults, so they see the final request.
   */
  public static OkHttpClient create(BackendSettings settings, Interceptor... extra) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(settings.connectTimeout())
            .readTimeout(settings.readTimeout())
            .callTimeout(settings.callTimeout())
            .retryOnConnectionFailure(false)
            .addInterceptor(new LanguageInterceptor(settings.language()))
            .addInterceptor(new LoggingInterceptor());
    for (Interceptor interceptor : extra) {
      builder.addInterceptor(interceptor);
    }
    return builder.build();
  }
}

package com.gentoro.recordbridge.http;

import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Appends the configured {@code lang} query parameter unless the request already carries one. */
public class LanguageInterceptor implements Interceptor {
  private final String language;

  public LanguageInterceptor(String language) {
    this.language = language;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    HttpUrl originalUrl = original.url();

    if (language == null || language.isBlank() || originalUrl.queryParameter("lang") != null) {
      return chain.proceed(original);
    }

    HttpUrl newUrl = originalUrl.newBuilder().addQueryParameter("lang", language).build();
    return chain.proceed(original.newBuilder().url(newUrl).build());
  }
}

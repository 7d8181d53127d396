package com.gentoro.recordbridge.support;

import com.gentoro.recordbridge.BackendSettings;
import com.gentoro.recordbridge.auth.AuthSessionManager;
import com.gentoro.recordbridge.auth.BackendAuthenticator;
import com.gentoro.recordbridge.dispatch.OperationDispatcher;
import com.gentoro.recordbridge.http.OkHttpFactory;
import com.gentoro.recordbridge.http.TransportClient;
import com.gentoro.recordbridge.registry.EntityRegistry;
import com.gentoro.recordbridge.request.RequestBuilder;
import com.gentoro.recordbridge.search.SearchEngine;
import java.time.Instant;
import okhttp3.OkHttpClient;

/** The full client stack wired against a {@link FakeBackend}. */
public class TestStack implements AutoCloseable {
  public static final String BASE_URL = "http://backend.test/api";

  public final FakeBackend backend = new FakeBackend();
  public final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
  public final BackendSettings settings;
  public final OkHttpClient httpClient;
  public final AuthSessionManager session;
  public final TransportClient transport;
  public final RequestBuilder requestBuilder = new RequestBuilder();
  public final SearchEngine searchEngine;
  public final EntityRegistry registry;
  public final OperationDispatcher dispatcher;

  public TestStack() {
    this(EntityRegistry.load("classpath:entities.yaml"));
  }

  public TestStack(EntityRegistry registry) {
    this.registry = registry;
    this.settings =
        BackendSettings.builder()
            .baseUrl(BASE_URL)
            .username("svc")
            .password("secret")
            .knowledgeBase("Demo")
            .language("en")
            .build();
    this.httpClient = OkHttpFactory.create(settings, backend);
    this.session =
        new AuthSessionManager(
            new BackendAuthenticator(httpClient, settings, clock), settings.safetyMargin(), clock);
    this.transport = new TransportClient(httpClient, settings.baseUrl(), session);
    this.searchEngine =
        new SearchEngine(
            transport,
            requestBuilder,
            settings.defaultSearchLimit(),
            settings.maxSearchLimit(),
            settings.searchParallelism());
    this.dispatcher = new OperationDispatcher(registry, requestBuilder, transport, searchEngine);
  }

  @Override
  public void close() {
    searchEngine.close();
  }
}

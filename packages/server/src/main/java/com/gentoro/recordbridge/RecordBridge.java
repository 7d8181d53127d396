package com.gentoro.recordbridge;

import com.gentoro.recordbridge.actuator.ActuatorService;
import com.gentoro.recordbridge.auth.AuthSessionManager;
import com.gentoro.recordbridge.auth.BackendAuthenticator;
import com.gentoro.recordbridge.dispatch.OperationDispatcher;
import com.gentoro.recordbridge.exception.ConfigException;
import com.gentoro.recordbridge.exception.RecordBridgeErrorCode;
import com.gentoro.recordbridge.exception.RecordBridgeException;
import com.gentoro.recordbridge.http.EmbeddedJettyServer;
import com.gentoro.recordbridge.http.OkHttpFactory;
import com.gentoro.recordbridge.http.TransportClient;
import com.gentoro.recordbridge.mcp.McpServer;
import com.gentoro.recordbridge.mcp.PromptCatalog;
import com.gentoro.recordbridge.mcp.ToolCatalog;
import com.gentoro.recordbridge.registry.EntityRegistry;
import com.gentoro.recordbridge.request.RequestBuilder;
import com.gentoro.recordbridge.search.SearchEngine;
import com.gentoro.recordbridge.workflow.WorkflowService;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Application wiring: builds every component from configuration and owns their lifecycle. */
public class RecordBridge {

  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(RecordBridge.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private BackendSettings settings;
  private EntityRegistry registry;
  private OkHttpClient httpClient;
  private AuthSessionManager sessionManager;
  private SearchEngine searchEngine;
  private OperationDispatcher dispatcher;
  private ToolCatalog toolCatalog;
  private PromptCatalog promptCatalog;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public RecordBridge(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Route everything through SLF4J; silence java.util.logging.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.recordbridge.logging.LoggingService.applyConfiguration(configuration());

    this.settings = BackendSettings.fromConfiguration(configuration());
    log.info("Backend settings: {}", settings);
    this.registry = EntityRegistry.load(configuration().getString("registry.location", null));

    this.httpClient = OkHttpFactory.create(settings);
    this.sessionManager =
        new AuthSessionManager(
            new BackendAuthenticator(httpClient, settings), settings.safetyMargin());
    TransportClient transport = new TransportClient(httpClient, settings.baseUrl(), sessionManager);
    RequestBuilder requestBuilder = new RequestBuilder();
    this.searchEngine =
        new SearchEngine(
            transport,
            requestBuilder,
            settings.defaultSearchLimit(),
            settings.maxSearchLimit(),
            settings.searchParallelism());
    this.dispatcher = new OperationDispatcher(registry, requestBuilder, transport, searchEngine);

    String toolPrefix = configuration().getString("http.mcp.tool.prefix", "agiloft");
    WorkflowService workflows =
        new WorkflowService(dispatcher, Clock.systemDefaultZone(), toolPrefix);
    this.toolCatalog =
        new ToolCatalog(
            registry,
            dispatcher,
            workflows,
            toolPrefix,
            settings.defaultSearchLimit(),
            settings.maxSearchLimit());
    this.promptCatalog = new PromptCatalog(toolPrefix);

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /** Block until the JVM is asked to stop, then release resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "recordbridge-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      closeQuietly("mcp", mcpServer);
      closeQuietly("http", httpServer);
      if (sessionManager != null) {
        sessionManager.logout();
      }
      closeQuietly("search", searchEngine);
      if (httpClient != null) {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
      }
      log.info("RecordBridge stopped");
    } finally {
      shutdownLatch.countDown();
    }
  }

  private void closeQuietly(String name, AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {} component: {}", name, e.getMessage());
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new RecordBridgeException(
          RecordBridgeErrorCode.CONFIGURATION_ERROR,
          "RecordBridge not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public BackendSettings settings() {
    return settings;
  }

  public EntityRegistry registry() {
    return registry;
  }

  public AuthSessionManager sessionManager() {
    return sessionManager;
  }

  public OperationDispatcher dispatcher() {
    return dispatcher;
  }

  public ToolCatalog toolCatalog() {
    return toolCatalog;
  }

  public PromptCatalog promptCatalog() {
    return promptCatalog;
  }

  public EmbeddedJettyServer httpServer() {
    if (httpServer == null) {
      throw new ConfigException("HTTP server not prepared");
    }
    return httpServer;
  }
}

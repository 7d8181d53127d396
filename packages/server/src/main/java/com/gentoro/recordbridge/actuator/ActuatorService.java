package com.gentoro.recordbridge.actuator;

import com.gentoro.recordbridge.RecordBridge;
import com.gentoro.recordbridge.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint at {@code /actuator/health}.
 *
 * <p>Response body: {@code {"status":"UP","session":"AUTHENTICATED","entities":7,"tools":86}}
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(ActuatorService.class);

  private final RecordBridge recordBridge;

  public ActuatorService(RecordBridge recordBridge) {
    this.recordBridge = recordBridge;
  }

  public void register() {
    recordBridge
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new ActuatorServlet(this)), "/actuator/health");
    log.info("Actuator health endpoint registered at /actuator/health");
  }

  /** Session state is reported, not probed: health checks never trigger a login. */
  public Map<String, Object> health() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("status", "UP");
    payload.put("session", recordBridge.sessionManager().state().name());
    payload.put("entities", recordBridge.registry().keys().size());
    payload.put("tools", recordBridge.toolCatalog().tools().size());
    return payload;
  }

  private static class ActuatorServlet extends HttpServlet {
    private final transient ActuatorService service;

    ActuatorServlet(ActuatorService service) {
      this.service = service;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(service.health()));
      }
    }
  }
}

package com.fieldflow.tracker.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fieldflow.tracker.exception.ErrorDetails;
import com.fieldflow.tracker.exception.ExceptionUtil;
import com.fieldflow.tracker.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** Response helpers shared by the management servlets. */
final class JsonResponses {
  private static final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  private JsonResponses() {}

  static void write(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(body));
  }

  /** {@code {"error": message, "code": ..., "type": ...}} */
  static void error(HttpServletResponse resp, int status, Throwable t) throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    ObjectNode node = mapper.createObjectNode();
    node.put("error", ExceptionUtil.extractErrorMessage(t));
    node.put("code", details.code().name());
    node.put("type", details.type());
    write(resp, status, node);
  }

  /** Job id from a path like {@code /abc}, or null. */
  static String jobId(String pathInfo) {
    if (pathInfo == null || pathInfo.length() <= 1) {
      return null;
    }
    String id = pathInfo.substring(1);
    return id.isBlank() || id.contains("/") ? null : id;
  }
}

package com.m4brew.management.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.m4brew.exception.ExceptionUtil;
import com.m4brew.exception.M4BrewException;
import com.m4brew.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** JSON helpers shared by the control endpoints. */
final class JsonResponses {
  static final ObjectMapper MAPPER = JacksonUtility.getJsonMapper();

  private JsonResponses() {}

  static void write(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(MAPPER.writeValueAsString(body));
  }

  static void error(HttpServletResponse resp, int status, String message) throws IOException {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("error", message);
    write(resp, status, node);
  }

  /** Error body carrying the exception's code and context. */
  static void error(HttpServletResponse resp, int status, M4BrewException e) throws IOException {
    write(resp, status, ExceptionUtil.toErrorDetails(e));
  }

  /** Parse the request body as a JSON object; an empty body reads as {@code {}}. */
  static ObjectNode readObject(HttpServletRequest req) throws IOException {
    JsonNode node = MAPPER.readTree(req.getInputStream());
    if (node == null || node.isMissingNode() || node.isNull()) {
      return MAPPER.createObjectNode();
    }
    if (!node.isObject()) {
      throw new IOException("Request body must be a JSON object");
    }
    return (ObjectNode) node;
  }
}

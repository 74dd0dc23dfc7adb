package com.m4brew.management.endpoints;

import com.m4brew.settings.Settings;
import com.m4brew.settings.SettingsService;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** {@code /api/settings}: GET the saved settings, POST a partial update. */
public final class SettingsServlet extends HttpServlet {
  private final SettingsService settings;

  public SettingsServlet(SettingsService settings) {
    this.settings = settings;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonResponses.write(resp, 200, settings.load());
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Settings requested;
    try {
      requested = JsonResponses.MAPPER.treeToValue(JsonResponses.readObject(req), Settings.class);
    } catch (IOException e) {
      JsonResponses.error(resp, 400, "Malformed settings: " + e.getMessage());
      return;
    }
    JsonResponses.write(resp, 200, settings.update(requested));
  }
}

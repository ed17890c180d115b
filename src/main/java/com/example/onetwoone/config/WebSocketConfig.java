package com.example.onetwoone.config;

import com.example.onetwoone.handler.ChatWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Mounts the chat socket. Browsers must come from {@code app.websocket.allowed-origins};
 * a front end served from localhost or 127.0.0.1 is accepted on any port, since dev servers hop ports.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final ChatWebSocketHandler chatHandler;
  private final String endpoint;
  private final List<String> originPatterns;

  public WebSocketConfig(
      ChatWebSocketHandler chatHandler,
      @Value("${app.websocket.path:/chat}") String endpoint,
      @Value("${app.websocket.allowed-origins:http://localhost:5173}") String allowedOrigins,
      // accept every origin, for local troubleshooting only
      @Value("${app.websocket.debug-open:false}") boolean anyOrigin
  ) {
    this.chatHandler = chatHandler;
    this.endpoint = endpoint;
    this.originPatterns = anyOrigin ? List.of("*") : originPatterns(allowedOrigins);
  }

  /** CSV of origins to Spring origin patterns; nothing configured means any origin. */
  static List<String> originPatterns(String csv) {
    Set<String> out = new LinkedHashSet<>();
    for (String raw : (csv == null ? "" : csv).split(",")) {
      String origin = raw.trim();
      if (origin.isEmpty()) continue;
      out.add(origin);
      int sep = origin.indexOf("://");
      if (sep > 0 && isLoopback(hostOf(origin, sep))) {
        String scheme = origin.substring(0, sep).toLowerCase(Locale.ROOT);
        out.add(scheme + "://localhost:*");
        out.add(scheme + "://127.0.0.1:*");
      }
    }
    return out.isEmpty() ? List.of("*") : new ArrayList<>(out);
  }

  private static String hostOf(String origin, int schemeSep) {
    String rest = origin.substring(schemeSep + 3);
    int colon = rest.indexOf(':');
    return (colon < 0 ? rest : rest.substring(0, colon)).toLowerCase(Locale.ROOT);
  }

  private static boolean isLoopback(String host) {
    return "localhost".equals(host) || "127.0.0.1".equals(host);
  }

  List<String> getOriginPatterns() {
    return originPatterns;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(chatHandler, endpoint)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }
}

package com.example.onetwoone.controller;

import com.example.onetwoone.service.ChatService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final ChatService chatService;

  public HealthController(ChatService chatService) {
    this.chatService = chatService;
  }

  /** Liveness probe; never touches room state */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "ok");
    m.put("onlineUsers", chatService.presence().total());
    return m;
  }
}

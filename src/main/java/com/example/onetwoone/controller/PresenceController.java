package com.example.onetwoone.controller;

import com.example.onetwoone.model.PresenceCounts;
import com.example.onetwoone.service.ChatService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** Same numbers the socket pushes as presence-counts, for clients that are not connected yet. */
@RestController
@RequestMapping("/api/presence")
public class PresenceController {

    private final ChatService chatService;

    public PresenceController(ChatService chatService) {
        this.chatService = chatService;
    }

    @GetMapping
    public Map<String, Object> presence() {
        PresenceCounts c = chatService.presence();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total", c.total());
        m.put("perMode", c.perMode());
        return m;
    }
}

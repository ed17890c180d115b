package com.example.onetwoone.controller;

import com.example.onetwoone.debate.DebateSummary;
import com.example.onetwoone.service.DebateService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/debates")
public class DebateBrowseController {

    private final DebateService debateService;

    public DebateBrowseController(DebateService debateService) {
        this.debateService = debateService;
    }

    /** Open debates, newest first; {@code q} filters by title or code. */
    @GetMapping
    public List<DebateSummary> list(@RequestParam(name = "q", required = false) String q) {
        return debateService.openDebates(q);
    }
}

package com.example.onetwoone.controller;

import com.example.onetwoone.debate.DebatePhase;
import com.example.onetwoone.debate.DebateSummary;
import com.example.onetwoone.service.DebateService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class DebateBrowseControllerTest {

    @Test
    void list_passesQueryAndRendersSummaries() throws Exception {
        // given
        DebateService debateService = Mockito.mock(DebateService.class);
        when(debateService.openDebates("cats")).thenReturn(List.of(
                new DebateSummary("ABCD2345", "Cats vs dogs", DebatePhase.LOBBY, 6, 1, 0,
                        Instant.parse("2026-01-01T10:00:00Z"))));

        MockMvc mvc = MockMvcBuilders.standaloneSetup(new DebateBrowseController(debateService)).build();

        // when/then
        mvc.perform(get("/api/debates").param("q", "cats"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$", hasSize(1)))
           .andExpect(jsonPath("$[0].code", is("ABCD2345")))
           .andExpect(jsonPath("$[0].phase", is("lobby")))
           .andExpect(jsonPath("$[0].debaters", is(1)));
        verify(debateService).openDebates("cats");
    }

    @Test
    void list_withoutQueryReturnsEverythingOpen() throws Exception {
        DebateService debateService = Mockito.mock(DebateService.class);
        when(debateService.openDebates(null)).thenReturn(List.of());

        MockMvc mvc = MockMvcBuilders.standaloneSetup(new DebateBrowseController(debateService)).build();

        mvc.perform(get("/api/debates"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$", hasSize(0)));
    }
}

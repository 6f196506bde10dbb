package com.gameday.leaguedata.controller;

import com.gameday.leaguedata.config.BoardSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ConfigController.class)
@ActiveProfiles("test")
@Import(BoardSettings.class)
@TestPropertySource(properties = "gameday.boards.standings-max-per-chunk=12")
class ConfigControllerTest {

    @Autowired private MockMvc mockMvc;

    @Test
    void exposesBoardLimits() throws Exception {
        mockMvc.perform(get("/api/config/boards"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.standingsMaxPerChunk").value(12))
                .andExpect(jsonPath("$.scheduleMaxPerChunk").value(10))
                .andExpect(jsonPath("$.topPoints").value(5));
    }
}

package edu.brandeis.cosi103a.golfleague.api;

import edu.brandeis.cosi103a.golfleague.LeagueFixtures;
import edu.brandeis.cosi103a.golfleague.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.golfleague.model.ScoreSubmission;
import edu.brandeis.cosi103a.golfleague.workflow.InMemoryLeagueStore;
import edu.brandeis.cosi103a.golfleague.workflow.MatchDayWorkflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Score entry over HTTP: JSON binding, request validation and error mapping.
 */
class ScoreEntryEndpointTest {

    private static final String ALICE_M1 =
        "{\"playerId\":\"alice\",\"matchId\":\"m1\",\"holeScores\":[5,4,6,5,5,4,6,5,5]}";

    private InMemoryLeagueStore store;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        store = LeagueFixtures.seasonStore();
        mockMvc = MockMvcBuilders.standaloneSetup(new MatchDayController(store))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(ObjectMapperFactory.create()))
            .build();
    }

    private static String batch(String... entries) {
        return "{\"scores\":[" + String.join(",", entries) + "]}";
    }

    @Test
    void mixedBatch_commitsValidCardAndWarnsOnNegativeScore() throws Exception {
        String bob = "{\"playerId\":\"bob\",\"matchId\":\"m1\",\"holeScores\":[-1,3,5,4,4,3,5,4,4]}";

        mockMvc.perform(post("/api/match-days/md1/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content(batch(ALICE_M1, bob)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.committed").value(1))
            .andExpect(jsonPath("$.warnings", contains("Invalid hole score -1 for player bob in match m1")))
            .andExpect(jsonPath("$.deferredMatchIds", contains("m1")));

        assertTrue(store.findScore("m1", "alice").isPresent());
        assertFalse(store.findScore("m1", "bob").isPresent());
    }

    @Test
    void nullHoleScore_isWarning() throws Exception {
        String bob = "{\"playerId\":\"bob\",\"matchId\":\"m1\",\"holeScores\":[null,3,5,4,4,3,5,4,4]}";

        mockMvc.perform(post("/api/match-days/md1/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content(batch(ALICE_M1, bob)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.warnings", contains("Invalid hole score null for player bob in match m1")));

        assertTrue(store.findScore("m1", "alice").isPresent());
    }

    @Test
    void nullAndBlankEntries_areWarnings() throws Exception {
        String blank = "{\"playerId\":\"\",\"matchId\":\"m1\",\"holeScores\":[4,3,5,4,4,3,5,4,4]}";

        mockMvc.perform(post("/api/match-days/md1/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content(batch(ALICE_M1, "null", blank)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.committed").value(1))
            .andExpect(jsonPath("$.warnings", contains(
                "Score is missing a player or match id",
                "Score is missing a player or match id")));
    }

    @Test
    void absentEntry_isScored() throws Exception {
        String bob = "{\"playerId\":\"bob\",\"matchId\":\"m1\",\"absent\":true}";

        mockMvc.perform(post("/api/match-days/md1/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content(batch(ALICE_M1, bob)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.committed").value(2))
            .andExpect(jsonPath("$.points.m1.playerAPoints").exists());

        assertTrue(store.findScore("m1", "bob").orElseThrow().absent());
    }

    @Test
    void noValidCards_badRequestWithWarnings() throws Exception {
        String unknown = "{\"playerId\":\"alice\",\"matchId\":\"m9\",\"holeScores\":[4,3,5,4,4,3,5,4,4]}";

        mockMvc.perform(post("/api/match-days/md1/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content(batch(unknown)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.committed").value(0))
            .andExpect(jsonPath("$.warnings", contains("Match m9 not found")));
    }

    @Test
    void emptyBatch_rejectedByValidation() throws Exception {
        mockMvc.perform(post("/api/match-days/md1/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scores\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void lockedWeek_forbidden() throws Exception {
        MatchDayWorkflow.submitScores(store, "md2",
            List.of(new ScoreSubmission("alice", "m3", LeagueFixtures.PAR_ROUND, false)));

        mockMvc.perform(post("/api/match-days/md1/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content(batch(ALICE_M1)))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("This match week is locked and scores cannot be modified"));

        assertFalse(store.findScore("m1", "alice").isPresent());
    }

    @Test
    void unknownMatchDay_notFound() throws Exception {
        mockMvc.perform(post("/api/match-days/md9/scores")
                .contentType(MediaType.APPLICATION_JSON)
                .content(batch(ALICE_M1)))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Match day not found: md9"));
    }

    @Test
    void handicap_servedAsJson() throws Exception {
        mockMvc.perform(get("/api/players/carol/handicap"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.playerId").value("carol"))
            .andExpect(jsonPath("$.handicapIndex").value(20.0))
            .andExpect(jsonPath("$.established").value(false));
    }
}

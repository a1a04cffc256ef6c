package edu.brandeis.cosi103a.golfleague.api;

import edu.brandeis.cosi103a.golfleague.api.dto.ScoreBatchRequest;
import edu.brandeis.cosi103a.golfleague.model.PlayerHandicap;
import edu.brandeis.cosi103a.golfleague.scoring.StandingsEntry;
import edu.brandeis.cosi103a.golfleague.workflow.LeagueDataNotFoundException;
import edu.brandeis.cosi103a.golfleague.workflow.LeagueStore;
import edu.brandeis.cosi103a.golfleague.workflow.MatchDayWorkflow;
import edu.brandeis.cosi103a.golfleague.workflow.ScoreBatchResult;
import edu.brandeis.cosi103a.golfleague.workflow.SeasonReports;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for entering scores and reading season results.
 */
@RestController
@RequestMapping("/api")
public class MatchDayController {

    private final LeagueStore store;

    public MatchDayController(LeagueStore store) {
        this.store = store;
    }

    /**
     * Enters or corrects a batch of cards for a match day.
     * Returns 201 when at least one card was saved, otherwise 400 with the warnings.
     */
    @PostMapping("/match-days/{matchDayId}/scores")
    public ResponseEntity<ScoreBatchResult> enterScores(
            @PathVariable String matchDayId,
            @Valid @RequestBody ScoreBatchRequest request) {
        ScoreBatchResult result = MatchDayWorkflow.submitScores(store, matchDayId, request.toSubmissions());
        HttpStatus status = result.committed() > 0 ? HttpStatus.CREATED : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/seasons/{seasonId}/match-days")
    public List<SeasonReports.ScheduledMatchDay> listMatchDays(@PathVariable String seasonId) {
        return SeasonReports.schedule(store, seasonId);
    }

    @GetMapping("/seasons/{seasonId}/standings")
    public List<StandingsEntry> standings(@PathVariable String seasonId) {
        return SeasonReports.standings(store, seasonId);
    }

    @GetMapping("/players/{playerId}/handicap")
    public PlayerHandicap handicap(@PathVariable String playerId) {
        return store.findHandicap(playerId)
            .orElseThrow(() -> new LeagueDataNotFoundException("No handicap for player: " + playerId));
    }
}

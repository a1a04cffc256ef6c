package edu.brandeis.cosi103a.golfleague.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.golfleague.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.golfleague.model.Course;
import edu.brandeis.cosi103a.golfleague.model.Match;
import edu.brandeis.cosi103a.golfleague.model.MatchDay;
import edu.brandeis.cosi103a.golfleague.model.MatchDayStatus;
import edu.brandeis.cosi103a.golfleague.workflow.InMemoryLeagueStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class LeagueSeedLoaderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = ObjectMapperFactory.create();

    private Path copySeed() throws IOException {
        Path target = tempDir.resolve("league.json");
        try (InputStream in = getClass().getResourceAsStream("/league-seed.json")) {
            assertNotNull(in, "league-seed.json test resource");
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void loadsSeedIntoStore() throws Exception {
        Path seedFile = copySeed();
        InMemoryLeagueStore store = new InMemoryLeagueStore();

        LeagueSeed seed = new LeagueSeedLoader(seedFile.toString(), objectMapper).loadInto(store);

        assertNotNull(seed);
        assertEquals(2, seed.players().size());

        Course course = store.findCourse("oak").orElseThrow();
        assertEquals(9, course.holeCount());
        assertEquals(113, course.slopeRating());

        MatchDay md1 = store.findMatchDay("md1").orElseThrow();
        assertEquals(LocalDate.of(2025, 5, 1), md1.date());
        assertEquals(MatchDayStatus.SCHEDULED, md1.status());
        assertEquals(MatchDayStatus.LOCKED, store.findMatchDay("md0").orElseThrow().status());

        Match m1 = store.findMatch("m1").orElseThrow();
        assertEquals(MatchDayStatus.SCHEDULED, m1.status());
        assertTrue(m1.points().isEmpty());

        assertEquals(11.7, store.findHandicap("bob").orElseThrow().handicapIndex(), 1e-9);
    }

    @Test
    void blankPath_loadsNothing() throws Exception {
        InMemoryLeagueStore store = new InMemoryLeagueStore();
        assertNull(new LeagueSeedLoader("", objectMapper).loadInto(store));
        assertTrue(store.findCourse("oak").isEmpty());
    }

    @Test
    void missingFile_throws() {
        LeagueSeedLoader loader = new LeagueSeedLoader(tempDir.resolve("nope.json").toString(), objectMapper);
        IOException e = assertThrows(IOException.class, () -> loader.loadInto(new InMemoryLeagueStore()));
        assertTrue(e.getMessage().startsWith("League seed file not found"));
    }

    @Test
    void malformedFile_throws() throws Exception {
        Path bad = tempDir.resolve("bad.json");
        Files.writeString(bad, "{\"courses\": [");
        LeagueSeedLoader loader = new LeagueSeedLoader(bad.toString(), objectMapper);
        assertThrows(IOException.class, () -> loader.loadInto(new InMemoryLeagueStore()));
    }
}

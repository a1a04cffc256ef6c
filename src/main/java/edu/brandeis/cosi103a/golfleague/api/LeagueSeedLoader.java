package edu.brandeis.cosi103a.golfleague.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.golfleague.workflow.InMemoryLeagueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the league seed file named by {@code league.seed-file}, if any.
 */
@Service
public class LeagueSeedLoader {

    private static final Logger log = LoggerFactory.getLogger(LeagueSeedLoader.class);

    private final String seedFile;
    private final ObjectMapper objectMapper;

    public LeagueSeedLoader(
            @Value("${league.seed-file:}") String seedFile,
            ObjectMapper objectMapper) {
        this.seedFile = seedFile;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the seed and writes it into the store. Does nothing when no seed file is configured.
     *
     * @return the seed that was applied, or null when none is configured
     * @throws IOException if the configured file is missing or not valid seed JSON
     */
    public LeagueSeed loadInto(InMemoryLeagueStore store) throws IOException {
        if (seedFile == null || seedFile.isBlank()) {
            log.info("No league seed file configured, starting with an empty league");
            return null;
        }
        Path path = Path.of(seedFile);
        if (!Files.exists(path)) {
            throw new IOException("League seed file not found: " + path);
        }
        LeagueSeed seed = objectMapper.readValue(path.toFile(), LeagueSeed.class);
        seed.applyTo(store);
        log.info("Loaded league seed from {}: {} courses, {} players, {} match days, {} matches",
            path, seed.courses().size(), seed.players().size(), seed.matchDays().size(), seed.matches().size());
        return seed;
    }
}

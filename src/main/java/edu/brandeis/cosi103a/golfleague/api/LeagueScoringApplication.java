package edu.brandeis.cosi103a.golfleague.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.golfleague.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.golfleague.workflow.InMemoryLeagueStore;
import edu.brandeis.cosi103a.golfleague.workflow.LeagueStore;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.IOException;

/**
 * Host application for the scoring engine. Serves score entry, schedules, standings and
 * handicaps over HTTP from an in-memory league seeded at startup.
 */
@SpringBootApplication
public class LeagueScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeagueScoringApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public LeagueStore leagueStore(LeagueSeedLoader seedLoader) throws IOException {
        InMemoryLeagueStore store = new InMemoryLeagueStore();
        seedLoader.loadInto(store);
        return store;
    }
}

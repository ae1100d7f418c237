package com.cinemaregistry.scrape;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.rate.PacingMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.getEndpoint().setUserAgents(List.of("   "));
        assertEquals(1, properties.getEndpoint().getUserAgents().size());
        assertTrue(properties.getEndpoint().getUserAgents().get(0).startsWith("Mozilla/5.0"));
    }

    @Test
    void countsAndTimeoutsAreClamped() {
        ScraperProperties properties = new ScraperProperties();
        properties.getRetry().setMaxAttempts(0);
        properties.getCli().setWorkerCount(-2);
        properties.getRun().setJoinTimeoutSeconds(0);
        properties.getRun().setCheckpointInterval(Duration.ZERO);
        properties.getEndpoint().setRequestTimeoutMs(-5);
        assertEquals(1, properties.getRetry().getMaxAttempts());
        assertEquals(1, properties.getCli().getWorkerCount());
        assertEquals(1, properties.getRun().getJoinTimeoutSeconds());
        assertEquals(Duration.ofMillis(100), properties.getRun().getCheckpointInterval());
        assertEquals(1, properties.getEndpoint().getRequestTimeoutMs());
    }

    @Test
    void checkpointIntervalDefaultsToOneHour() {
        ScraperProperties properties = new ScraperProperties();
        assertEquals(Duration.ofMinutes(60), properties.getRun().getCheckpointInterval());
        properties.getRun().setCheckpointInterval(null);
        assertEquals(Duration.ofMinutes(60), properties.getRun().getCheckpointInterval());
        properties.getRun().setCheckpointInterval(Duration.ofSeconds(2));
        assertEquals(Duration.ofSeconds(2), properties.getRun().getCheckpointInterval());
    }

    @Test
    void rateDefaultsMatchCalibratedController() {
        ScraperProperties.Rate rate = new ScraperProperties().getRate();
        assertEquals(0.3, rate.getInitialIntervalSeconds());
        assertEquals(0.05, rate.getMinIntervalSeconds());
        assertEquals(5.0, rate.getMaxIntervalSeconds());
        assertEquals(PacingMode.CONFIRMED, rate.getPacingMode());

        rate.setPacingMode(null);
        rate.setMaxIntervalSeconds(0.01);
        assertEquals(PacingMode.CONFIRMED, rate.getPacingMode());
        assertEquals(0.05, rate.getMaxIntervalSeconds());
    }
}

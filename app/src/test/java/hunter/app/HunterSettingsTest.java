package hunter.app;

import hunter.engine.CrashPhase;
import hunter.opportunity.OpportunitySettings;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HunterSettingsTest {

    @Test
    void classpathDefaultsMatchProductionSettings() {
        OpportunitySettings settings = HunterSettings.load(Map.of()).toOpportunitySettings();

        Assertions.assertEquals(75, settings.intentThreshold());
        Assertions.assertEquals("#gtm-opportunities", settings.channel());
        Assertions.assertEquals(3, settings.analysisRetry().maxAttempts());
        Assertions.assertEquals(Duration.ofSeconds(10), settings.analysisRetry().maxBackoff());
        Assertions.assertEquals(Duration.ofSeconds(5), settings.deliveryRetry().maxBackoff());
        Assertions.assertEquals(Duration.ofMinutes(5), settings.analysisTimeout());
        Assertions.assertEquals(Duration.ofMinutes(2), settings.deliveryTimeout());
        Assertions.assertEquals(4, settings.schedulerConfig().maxConcurrency());
    }

    @Test
    void laterSourcesWin() {
        Properties defaults = new Properties();
        defaults.setProperty("intent-threshold", "75");
        defaults.setProperty("max-concurrency", "4");
        defaults.setProperty("channel", "#from-file");

        HunterSettings settings = HunterSettings.resolve(defaults,
                Map.of("HUNTER_INTENT_THRESHOLD", "60", "HUNTER_MAX_CONCURRENCY", "8"),
                Map.of("intent-threshold", "50"));

        Assertions.assertEquals(50, settings.intentThreshold());
        Assertions.assertEquals(8, settings.maxConcurrency());
        Assertions.assertEquals("#from-file", settings.channel());
    }

    @Test
    void environmentNamesAreDerivedFromKeys() {
        Assertions.assertEquals("HUNTER_POLL_INTERVAL_SECONDS", HunterSettings.envName("poll-interval-seconds"));
    }

    @Test
    void rejectsOutOfRangeAndMalformedValues() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> settings(Map.of("intent-threshold", "101")).intentThreshold());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> settings(Map.of("max-concurrency", "four")).maxConcurrency());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> settings(Map.of("history", "redis")).inMemoryHistory());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> settings(Map.of("initial-backoff-ms", "20000")).analysisRetry());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> settings(Map.of("crash-phase", "sometimes")).crashConfig());
    }

    @Test
    void rejectsDatabaseOutsideWorkingDirectory() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> HunterSettings.resolveSafeDbPath("../outside.db"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> HunterSettings.resolveSafeDbPath("hunter.txt"));
    }

    @Test
    void crashSettingsAreCarriedToScheduler() {
        OpportunitySettings settings = settings(Map.of("crash-step", "deliver-brief",
                "crash-phase", "after-commit")).toOpportunitySettings();

        Assertions.assertEquals("deliver-brief", settings.schedulerConfig().crashConfig().stepName());
        Assertions.assertEquals(CrashPhase.AFTER_COMMIT, settings.schedulerConfig().crashConfig().phase());
    }

    private static HunterSettings settings(Map<String, String> cli) {
        return HunterSettings.resolve(new Properties(), Map.of(), cli);
    }
}

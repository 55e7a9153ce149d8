package hunter.opportunity;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunter.engine.Signal;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileSignalIntakeTest {
    @TempDir
    Path tempDir;

    private static final String ACCOUNTS = """
            [
              {
                "account_id": "acme",
                "company_name": "Acme Corp",
                "industry": "Financial Services",
                "employee_count": 1200,
                "revenue": "$150M",
                "intent_score": 85,
                "intent_signals": [
                  {"type": "demo_request", "user_title": "CISO", "timestamp": "2024-01-15T12:00:00Z"},
                  {"type": "pricing_page_visit", "user_title": "CFO", "timestamp": "2024-01-15T10:30:00"}
                ],
                "processed": false
              },
              {
                "account_id": "globex",
                "company_name": "Globex",
                "intent_score": 91,
                "intent_signals": [],
                "processed": true
              },
              {
                "company_name": "No Id Inc",
                "intent_score": 70
              }
            ]
            """;

    @Test
    void readsUnprocessedAccountsAsSignals() throws Exception {
        JsonFileSignalIntake intake = intake(ACCOUNTS);

        List<Signal> signals = intake.poll();

        Assertions.assertEquals(1, signals.size());
        Signal acme = signals.get(0);
        Assertions.assertEquals("acme", acme.accountId());
        Assertions.assertEquals(85, acme.intentScore());
        Assertions.assertEquals("Acme Corp", acme.attribute(Signal.COMPANY_NAME));
        Assertions.assertEquals("1200", acme.attribute(Signal.EMPLOYEE_COUNT));
        Assertions.assertEquals("pricing_page_visit", acme.observedMetrics().get(0).type());
        Assertions.assertEquals(Instant.parse("2024-01-15T10:30:00Z").toEpochMilli(), acme.firstSeenMs());
        Assertions.assertEquals(Instant.parse("2024-01-15T12:00:00Z").toEpochMilli(), acme.lastSeenMs());
    }

    @Test
    void sameObservationIsReturnedOnce() throws Exception {
        JsonFileSignalIntake intake = intake(ACCOUNTS);

        Assertions.assertEquals(1, intake.poll().size());
        Assertions.assertTrue(intake.poll().isEmpty());
    }

    @Test
    void observationsNoLongerInTheFileAreForgotten() throws Exception {
        JsonFileSignalIntake intake = intake(ACCOUNTS);
        Assertions.assertEquals(1, intake.poll().size());

        Files.writeString(tempDir.resolve("accounts.json"), "[]", StandardCharsets.UTF_8);
        Assertions.assertTrue(intake.poll().isEmpty());

        Files.writeString(tempDir.resolve("accounts.json"), ACCOUNTS, StandardCharsets.UTF_8);
        List<Signal> again = intake.poll();
        Assertions.assertEquals(List.of("acme"), again.stream().map(Signal::accountId).toList());
    }

    @Test
    void missingFileYieldsNothing() throws Exception {
        JsonFileSignalIntake intake = new JsonFileSignalIntake(tempDir.resolve("absent.json"), new ObjectMapper());

        Assertions.assertTrue(intake.poll().isEmpty());
    }

    @Test
    void nonArrayFileIsAnError() throws Exception {
        JsonFileSignalIntake intake = intake("{\"account_id\": \"acme\"}");

        Assertions.assertThrows(IOException.class, intake::poll);
    }

    private JsonFileSignalIntake intake(String content) throws IOException {
        Path file = tempDir.resolve("accounts.json");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return new JsonFileSignalIntake(file, new ObjectMapper());
    }
}

package hunter.app;

import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AppTest {

    @Test
    void parsesFlagsAndOptions() {
        Map<String, String> parsed = App.parseArgs(new String[] {
                "--once", "--intent-threshold", " 60 ", "--db", "runs.db"});

        Assertions.assertEquals("true", parsed.get("once"));
        Assertions.assertEquals("60", parsed.get("intent-threshold"));
        Assertions.assertEquals("runs.db", parsed.get("db"));
    }

    @Test
    void rejectsUnknownDuplicateAndIncompleteArguments() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[] {"--verbose"}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> App.parseArgs(new String[] {"--db", "a.db", "--db", "b.db"}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[] {"--cancel"}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[] {"once"}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> App.parseArgs(new String[] {"--channel", "#gtm\u0007"}));
    }
}

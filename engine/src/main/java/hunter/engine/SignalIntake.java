package hunter.engine;

import java.io.IOException;
import java.util.List;

public interface SignalIntake {
    List<Signal> poll() throws IOException;
}

package network.compose.twopc.sim.runtime;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class SimulatorMainTest {

    @Test
    void helpExitsCleanly() {
        assertEquals(0, SimulatorMain.run(new String[] { "--help" }));
    }

    @Test
    void invalidArgumentsExitWithUsageError() {
        assertEquals(2, SimulatorMain.run(new String[] { "--clients", "none" }));
        assertEquals(2, SimulatorMain.run(new String[] { "--bogus", "1" }));
    }

    @Test
    void unreachableCoordinatorExitsWithFailure() throws IOException {
        int closedPort;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = probe.getLocalPort();
        }

        assertEquals(1, SimulatorMain.run(new String[] {
            "--host", "127.0.0.1", "--port", Integer.toString(closedPort), "--clients", "1", "--duration", "5"
        }));
    }
}

package ir.sahab.rpcnetwork;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.Test;

/**
 * Waits on services whose "container" is a server socket on localhost.
 */
public class WaitForTest {

    private static RunningService localService(int serviceId, int port) {
        return new RunningService(serviceId, "service-" + serviceId, "127.0.0.1", "container-" + serviceId, port,
                Map.of(port, port));
    }

    private static RunningNetwork network(Set<Integer> terminals, RunningService... services) {
        Map<Integer, RunningService> servicesById = new LinkedHashMap<>();
        for (RunningService service : services) {
            servicesById.put(service.getServiceId(), service);
        }
        return new RunningNetwork(servicesById, terminals, true);
    }

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }

    @Test(timeout = 10000)
    public void testPortOpen() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            int port = server.getLocalPort();
            RunningNetwork network = network(Set.of(0), localService(0, port));

            assertThatCode(() -> WaitFor.portOpen(0, port, 5000).process(network)).doesNotThrowAnyException();
        }
    }

    @Test(timeout = 10000)
    public void testPortNeverOpens() throws Exception {
        int port = closedPort();
        RunningNetwork network = network(Set.of(0), localService(0, port));

        assertThatThrownBy(() -> WaitFor.portOpen(0, port, 300, 50).process(network))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("service 0");
    }

    @Test(timeout = 10000)
    public void testTerminalServicesListening() throws Exception {
        try (ServerSocket terminal = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            // Service 0 is not terminal so its closed port is never checked
            RunningNetwork network = network(Set.of(1),
                    localService(0, closedPort()), localService(1, terminal.getLocalPort()));

            assertThatCode(() -> WaitFor.terminalServicesListening(5000).process(network))
                    .doesNotThrowAnyException();
        }
    }

    @Test(timeout = 10000)
    public void testTerminalServiceNotListening() throws Exception {
        int port = closedPort();
        RunningNetwork network = network(Set.of(0), localService(0, port));

        assertThatThrownBy(() -> new WaitFor.TerminalServicesChecker(300, 50).process(network))
                .isInstanceOf(IOException.class);
    }

    @Test
    public void testUnknownService() {
        RunningNetwork network = network(Set.of());

        assertThatThrownBy(() -> WaitFor.portOpen(3, 9650).process(network))
                .isInstanceOf(java.util.NoSuchElementException.class);
    }
}

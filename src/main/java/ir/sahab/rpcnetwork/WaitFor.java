package ir.sahab.rpcnetwork;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains helper methods to create startup callbacks which wait for some conditions to become true.
 */
public class WaitFor {

    private static final int DEFAULT_TIMEOUT_MILLIS = 60_000;
    private static final int DEFAULT_RETRY_WAIT_MILLIS = 100;

    private WaitFor() {
    }

    /**
     * Busy waits for a service. It tries to connect to the given port of its container until timeout reaches.
     */
    public static class PortOpenChecker implements StartupCallback {

        private static final Logger logger = LoggerFactory.getLogger(PortOpenChecker.class);

        private final int serviceId;
        private final int internalPort;
        private final int timeout;
        private final int retryWaitTime;

        /**
         * @param serviceId the id of the service to be checked
         * @param internalPort the container-internal port to check
         * @param timeout timeout in milliseconds before check is failed.
         * @param retryWaitTime time to wait in milliseconds between two tries
         */
        public PortOpenChecker(int serviceId, int internalPort, int timeout, int retryWaitTime) {
            Validate.isTrue(timeout > 0, "Timeout must be positive");
            Validate.isTrue(retryWaitTime >= 0, "Retry wait time can not be negative");

            this.serviceId = serviceId;
            this.internalPort = internalPort;
            this.timeout = timeout;
            this.retryWaitTime = retryWaitTime;
        }

        @Override
        public void process(RunningNetwork network) throws Exception {
            RunningService service = network.getService(serviceId);
            await(service.getIpAddress(), internalPort, timeout, retryWaitTime, serviceId);
        }

        static void await(String address, int port, int timeout, int retryWaitTime, int serviceId)
                throws IOException, InterruptedException {
            logger.info("Waiting for opening port {} of service {} (Address={}).", port, serviceId, address);
            long startTime = System.currentTimeMillis();
            while (System.currentTimeMillis() - startTime <= timeout) {
                try (Socket socket = new Socket()) {
                    socket.connect(new InetSocketAddress(address, port), timeout);
                    logger.info("Port {} of service {} opened.", port, serviceId);
                    return;
                } catch (IOException e) {
                    Thread.sleep(retryWaitTime);
                }
            }
            throw new IOException(String.format("Can not connect to service %d at %s:%d", serviceId, address, port));
        }
    }

    /**
     * Waits for the JSON-RPC port of every terminal service of a network. Once the terminal services listen, every
     * service they depend on has already been started, since a dependent starts after its dependencies.
     */
    public static class TerminalServicesChecker implements StartupCallback {

        private final int timeout;
        private final int retryWaitTime;

        public TerminalServicesChecker(int timeout, int retryWaitTime) {
            Validate.isTrue(timeout > 0, "Timeout must be positive");
            Validate.isTrue(retryWaitTime >= 0, "Retry wait time can not be negative");

            this.timeout = timeout;
            this.retryWaitTime = retryWaitTime;
        }

        @Override
        public void process(RunningNetwork network) throws Exception {
            long deadline = System.currentTimeMillis() + timeout;
            for (Integer serviceId : network.getTerminalServiceIds()) {
                RunningService service = network.getService(serviceId);
                // All terminal services share one timeout
                int remaining = (int) Math.max(1, deadline - System.currentTimeMillis());
                PortOpenChecker.await(service.getIpAddress(), service.getJsonRpcPort(), remaining, retryWaitTime,
                        serviceId);
            }
        }
    }

    /**
     * Waits for the given port of the given service to be available at most 60 seconds. Check will be performed in
     * periods of 100 milliseconds.
     */
    public static StartupCallback portOpen(int serviceId, int internalPort) {
        return new PortOpenChecker(serviceId, internalPort, DEFAULT_TIMEOUT_MILLIS, DEFAULT_RETRY_WAIT_MILLIS);
    }

    /**
     * Waits for the given port of the given service to be available at most timeout milliseconds. Check will be
     * performed in periods of 100 milliseconds.
     */
    public static StartupCallback portOpen(int serviceId, int internalPort, int timeout) {
        return new PortOpenChecker(serviceId, internalPort, timeout, DEFAULT_RETRY_WAIT_MILLIS);
    }

    /**
     * Waits for the given port of the given service to be available at most timeout milliseconds. Check will be
     * performed in periods of the given retryWaitTime in milliseconds.
     */
    public static StartupCallback portOpen(int serviceId, int internalPort, int timeout, int retryWaitTime) {
        return new PortOpenChecker(serviceId, internalPort, timeout, retryWaitTime);
    }

    /**
     * Waits at most 60 seconds for the JSON-RPC ports of all terminal services to be available.
     */
    public static StartupCallback terminalServicesListening() {
        return new TerminalServicesChecker(DEFAULT_TIMEOUT_MILLIS, DEFAULT_RETRY_WAIT_MILLIS);
    }

    /**
     * Waits at most timeout milliseconds for the JSON-RPC ports of all terminal services to be available.
     */
    public static StartupCallback terminalServicesListening(int timeout) {
        return new TerminalServicesChecker(timeout, DEFAULT_RETRY_WAIT_MILLIS);
    }
}

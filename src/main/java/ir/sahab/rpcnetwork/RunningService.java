package ir.sahab.rpcnetwork;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * A service of a network whose container has been started.
 * <p>Other containers reach the service by its hostname (see {@link #getSocket()}). From the host machine it can be
 * reached either on its container IP and internal ports, or on localhost and the host ports its internal ports are
 * published on.</p>
 */
public class RunningService {

    private final int serviceId;
    private final String hostname;
    private final String ipAddress;
    private final String containerId;
    private final int jsonRpcPort;
    private final Map<Integer, Integer> portBindings;

    /**
     * @param serviceId the id of the service in its graph.
     * @param hostname hostname of the container inside the docker network.
     * @param ipAddress IP of the container inside the docker network.
     * @param containerId the id the container runtime assigned to the container.
     * @param jsonRpcPort the container-internal JSON-RPC port.
     * @param portBindings mappings from internal ports to the leased host ports.
     */
    RunningService(int serviceId, String hostname, String ipAddress, String containerId, int jsonRpcPort,
            Map<Integer, Integer> portBindings) {
        Validate.notEmpty(hostname, "Hostname can not be empty");
        Validate.notEmpty(ipAddress, "IP address can not be empty");
        Validate.notEmpty(containerId, "Container id can not be empty");
        Validate.notNull(portBindings, "Port bindings are required");

        this.serviceId = serviceId;
        this.hostname = hostname;
        this.ipAddress = ipAddress;
        this.containerId = containerId;
        this.jsonRpcPort = jsonRpcPort;
        this.portBindings = Collections.unmodifiableMap(new LinkedHashMap<>(portBindings));
    }

    public int getServiceId() {
        return serviceId;
    }

    public String getHostname() {
        return hostname;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getContainerId() {
        return containerId;
    }

    public int getJsonRpcPort() {
        return jsonRpcPort;
    }

    /**
     * Returns the socket on which the other containers of the network reach the JSON-RPC port of this service.
     */
    public ServiceSocket getSocket() {
        return new ServiceSocket(hostname, jsonRpcPort);
    }

    /**
     * Returns the host port the given internal port is published on.
     *
     * @throws IllegalArgumentException if the internal port is not published.
     */
    public int getHostPort(int internalPort) {
        Integer hostPort = portBindings.get(internalPort);
        Validate.isTrue(hostPort != null, "Port %d of service %d is not published", internalPort, serviceId);
        return hostPort;
    }

    /**
     * Returns mappings from internal ports to the host ports leased for them.
     */
    public Map<Integer, Integer> getPortBindings() {
        return portBindings;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("serviceId", serviceId)
                .append("hostname", hostname)
                .append("ipAddress", ipAddress)
                .append("containerId", containerId)
                .append("portBindings", portBindings)
                .toString();
    }
}

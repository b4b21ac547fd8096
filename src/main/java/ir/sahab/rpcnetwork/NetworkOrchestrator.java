package ir.sahab.rpcnetwork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the services of a {@link ServiceGraph} as containers, one at a time and in the start order of the graph.
 * <p>Before a service is started, the sockets and liveness requests of its dependencies (which are already running)
 * are passed to its definition to render its start command. One host port is leased from the {@link PortAllocator} for
 * each port the service declares.</p>
 * <p>Nothing is retried. If a service can not be started, the services started before it are left running and are
 * handed to the caller inside the thrown {@link ServiceStartException}; use {@link #tearDown(RunningNetwork)} to remove
 * them.</p>
 */
public class NetworkOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(NetworkOrchestrator.class);

    /**
     * Hostname prefix used when none is given. It is the same for every orchestrator, see
     * {@link #NetworkOrchestrator(ContainerRuntime, PortAllocator, String)} before sharing a docker network.
     */
    public static final String DEFAULT_HOSTNAME_PREFIX = "service-";

    private final ContainerRuntime runtime;
    private final PortAllocator portAllocator;
    private final String hostnamePrefix;

    public NetworkOrchestrator(ContainerRuntime runtime, PortAllocator portAllocator) {
        this(runtime, portAllocator, DEFAULT_HOSTNAME_PREFIX);
    }

    /**
     * @param runtime the container runtime to start containers on.
     * @param portAllocator where host ports are leased from, can be shared with other orchestrators.
     * @param hostnamePrefix the hostname of each container is this prefix followed by its service id. Hostnames are
     *      also registered as docker network aliases, so orchestrations whose containers share a docker network must
     *      use distinct prefixes, otherwise docker DNS resolves a hostname to the containers of either network.
     */
    public NetworkOrchestrator(ContainerRuntime runtime, PortAllocator portAllocator, String hostnamePrefix) {
        Validate.notNull(runtime, "Container runtime is required");
        Validate.notNull(portAllocator, "Port allocator is required");
        Validate.notEmpty(hostnamePrefix, "Hostname prefix can not be empty");

        this.runtime = runtime;
        this.portAllocator = portAllocator;
        this.hostnamePrefix = hostnamePrefix;
    }

    /**
     * Starts all services of the given graph.
     *
     * @return the started network, containing every service of the graph.
     * @throws ServiceStartException if a service can not be started. Services started before it keep running and are
     *      available from {@link ServiceStartException#getPartialNetwork()}.
     */
    public RunningNetwork createAndRun(ServiceGraph graph) throws ServiceStartException {
        Validate.notNull(graph, "Graph is required");

        Map<Integer, JsonRpcRequest> livenessRequests = new HashMap<>();
        for (Integer serviceId : graph.getStartOrder()) {
            livenessRequests.put(serviceId, graph.getDefinition(serviceId).getLivenessRequest());
        }

        logger.info("Starting a network of {} services in order {}.", graph.size(), graph.getStartOrder());
        Map<Integer, RunningService> runningServices = new LinkedHashMap<>();
        for (Integer serviceId : graph.getStartOrder()) {
            try {
                RunningService service = startService(serviceId, graph, livenessRequests, runningServices);
                runningServices.put(serviceId, service);
                logger.info("Service {} started: {}", serviceId, service);
            } catch (ContainerRuntimeException | RuntimeException e) {
                logger.error("Could not start service {}, aborting with {} service(s) already running.",
                        serviceId, runningServices.size(), e);
                RunningNetwork partialNetwork =
                        new RunningNetwork(runningServices, graph.getTerminalServiceIds(), false);
                throw new ServiceStartException(serviceId, partialNetwork, e);
            }
        }

        logger.info("All {} services started, terminal services are {}.", runningServices.size(),
                graph.getTerminalServiceIds());
        return new RunningNetwork(runningServices, graph.getTerminalServiceIds(), true);
    }

    private RunningService startService(int serviceId, ServiceGraph graph, Map<Integer, JsonRpcRequest> livenessRequests,
            Map<Integer, RunningService> runningServices) throws ContainerRuntimeException {
        ServiceDefinition definition = graph.getDefinition(serviceId);

        // Dependencies are already running since the start order is topological
        Map<ServiceSocket, JsonRpcRequest> dependencyLivenessRequests = new LinkedHashMap<>();
        for (Integer dependencyId : graph.getDependencies(serviceId)) {
            RunningService dependency = runningServices.get(dependencyId);
            Validate.validState(dependency != null, "Dependency %d of service %d is not running", dependencyId,
                    serviceId);
            dependencyLivenessRequests.put(dependency.getSocket(), livenessRequests.get(dependencyId));
        }

        String hostname = hostnamePrefix + serviceId;
        Map<Integer, Integer> portBindings = new LinkedHashMap<>();
        String containerId = null;
        try {
            for (Integer internalPort : getInternalPorts(definition)) {
                portBindings.put(internalPort, portAllocator.lease());
            }

            List<String> command = definition.getStartCommand(hostname,
                    Collections.unmodifiableMap(dependencyLivenessRequests));
            Validate.validState(command != null, "Service %d rendered a null start command", serviceId);

            ContainerConfig config = new ContainerConfig(hostname, definition.getImage(), command, portBindings);
            logger.info("Starting service {} with {}", serviceId, config);
            containerId = runtime.createAndStart(config);
            String ipAddress = runtime.inspectIpAddress(containerId);
            return new RunningService(serviceId, hostname, ipAddress, containerId, definition.getJsonRpcPort(),
                    portBindings);
        } catch (ContainerRuntimeException | RuntimeException e) {
            // No running service owns these ports or this container, so they would leak otherwise
            portBindings.values().forEach(portAllocator::release);
            if (containerId != null) {
                removeAfterFailure(containerId, e);
            }
            throw e;
        }
    }

    private void removeAfterFailure(String containerId, Exception failure) {
        try {
            runtime.stopAndRemove(containerId);
        } catch (ContainerTeardownException e) {
            logger.warn("Could not remove container {} of the failed service.", containerId, e);
            failure.addSuppressed(e);
        }
    }

    private static Set<Integer> getInternalPorts(ServiceDefinition definition) {
        Set<Integer> ports = new LinkedHashSet<>();
        ports.add(definition.getJsonRpcPort());
        List<Integer> otherPorts = definition.getOtherPorts();
        if (otherPorts != null) {
            ports.addAll(otherPorts);
        }
        return ports;
    }

    /**
     * Removes the containers of the given network in reverse start order and releases the host ports leased for them.
     * A failure does not stop the teardown of the remaining services.
     *
     * @throws ContainerTeardownException the first failure, with the others added as suppressed exceptions. The ports
     *      of a service whose container could not be removed are not released.
     */
    public void tearDown(RunningNetwork network) throws ContainerTeardownException {
        Validate.notNull(network, "Network is required");

        List<RunningService> services = new ArrayList<>(network.getAllServices());
        Collections.reverse(services);
        ContainerTeardownException failure = null;
        for (RunningService service : services) {
            try {
                runtime.stopAndRemove(service.getContainerId());
                service.getPortBindings().values().forEach(portAllocator::release);
                logger.info("Service {} (container {}) removed.", service.getServiceId(), service.getContainerId());
            } catch (ContainerTeardownException e) {
                logger.warn("Could not remove service {} (container {}).", service.getServiceId(),
                        service.getContainerId(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

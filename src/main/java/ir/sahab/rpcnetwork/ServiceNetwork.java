package ir.sahab.rpcnetwork;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.junit.rules.ExternalResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A junit rule to start a network of JSON-RPC services as docker containers. You must build an instance of this rule
 * using its {@link #builder()} method and give it the {@link ServiceGraph} of your services. You can access the
 * running services by their ids using {@link #getService(int)}.
 * <p>If a service fails to start, or a startup callback fails, the containers started so far are removed before the
 * failure is reported, so a broken network never outlives the rule.</p>
 */
public class ServiceNetwork extends ExternalResource {

    private static final Logger logger = LoggerFactory.getLogger(ServiceNetwork.class);

    private final ServiceGraph graph;
    private final NetworkOrchestrator orchestrator;
    private final List<StartupCallback> startupCallbacks;
    private final boolean forceDown;
    private RunningNetwork network;

    private ServiceNetwork(Builder builder) {
        this.graph = builder.graph;
        this.orchestrator = new NetworkOrchestrator(builder.runtime, builder.portAllocator, builder.hostnamePrefix);
        this.startupCallbacks = new ArrayList<>(builder.startupCallbacks);
        this.forceDown = builder.forceDown;
    }

    @Override
    protected void before() throws Throwable {
        logger.info("Starting service network: {}", graph);
        try {
            network = orchestrator.createAndRun(graph);
        } catch (ServiceStartException e) {
            tearDownQuietly(e.getPartialNetwork(), e);
            throw e;
        }
        logger.info("Service network is up: {}", network);

        // Wait for callbacks to be run completely
        for (StartupCallback callback : startupCallbacks) {
            try {
                callback.process(network);
            } catch (Exception e) {
                tearDownQuietly(network, e);
                network = null;
                throw e;
            }
        }
    }

    /**
     * Removes the containers of the network only if the rule asks for force down. This is a best-effort operation
     * without any guarantees about the result.
     */
    @Override
    protected void after() {
        if (network == null || !forceDown) {
            return;
        }
        logger.info("Stopping service network: {}", network);
        try {
            orchestrator.tearDown(network);
            logger.info("Service network stopped!");
        } catch (ContainerTeardownException e) {
            // We don't care
            logger.warn("Unable to stop service network: {}", network, e);
        }
        network = null;
    }

    private void tearDownQuietly(RunningNetwork partialNetwork, Exception failure) {
        try {
            orchestrator.tearDown(partialNetwork);
        } catch (ContainerTeardownException e) {
            logger.warn("Unable to remove services of the failed network: {}", partialNetwork, e);
            failure.addSuppressed(e);
        }
    }

    /**
     * Returns the running network.
     *
     * @throws IllegalStateException if the network is not started.
     */
    public RunningNetwork getNetwork() {
        Validate.validState(network != null, "The service network is not running");
        return network;
    }

    /**
     * Returns a running service by its id.
     *
     * @throws java.util.NoSuchElementException if no service with such id exists.
     */
    public RunningService getService(int serviceId) {
        return getNetwork().getService(serviceId);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("graph", graph)
                .append("startupCallbacks", startupCallbacks)
                .append("forceDown", forceDown)
                .append("network", network)
                .toString();
    }

    /**
     * Returns a builder to describe the network to run: its services as a {@link ServiceGraph}, the container runtime
     * to run them on and where to lease host ports from.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private ServiceGraph graph;
        private ContainerRuntime runtime;
        private PortAllocator portAllocator;
        private String hostnamePrefix = NetworkOrchestrator.DEFAULT_HOSTNAME_PREFIX;
        private boolean forceDown = false;
        private final List<StartupCallback> startupCallbacks = new ArrayList<>();

        Builder() {
        }

        /**
         * Sets the services to run, required.
         */
        public Builder graph(ServiceGraph graph) {
            Validate.notNull(graph, "Graph must not be null");

            this.graph = graph;
            return this;
        }

        /**
         * Sets the container runtime, required.
         */
        public Builder runtime(ContainerRuntime runtime) {
            Validate.notNull(runtime, "Runtime must not be null");

            this.runtime = runtime;
            return this;
        }

        /**
         * Leases host ports from a new allocator of the given inclusive range.
         */
        public Builder portRange(int start, int end) {
            return portAllocator(new PortAllocator(start, end));
        }

        /**
         * Leases host ports from the given allocator, which may be shared with other networks.
         */
        public Builder portAllocator(PortAllocator portAllocator) {
            Validate.notNull(portAllocator, "Port allocator must not be null");

            this.portAllocator = portAllocator;
            return this;
        }

        /**
         * Sets the prefix of container hostnames, which are this prefix followed by the service id. Networks running
         * at the same time on one docker network need distinct prefixes, since their hostnames are registered as
         * network aliases and would otherwise resolve to each other's containers.
         */
        public Builder hostnamePrefix(String hostnamePrefix) {
            Validate.notEmpty(hostnamePrefix, "Hostname prefix must not be empty");

            this.hostnamePrefix = hostnamePrefix;
            return this;
        }

        /**
         * Forces the containers of the network to be removed after the test. If you don't enable this option, the
         * containers keep running after the test and their host ports stay leased.
         */
        public Builder forceDown() {
            this.forceDown = true;
            return this;
        }

        /**
         * Adds a callback which will be called after all containers of the network are started. Several callbacks can
         * be added and they will be called in the same order. Each call is blocking and if one of them throw an
         * exception, the remaining ones are not run and the startup process will fail.
         */
        public Builder afterStart(StartupCallback callback) {
            Validate.notNull(callback, "Callback must not be null");

            startupCallbacks.add(callback);
            return this;
        }

        /**
         * Builds the rule.
         */
        public ServiceNetwork build() {
            Validate.notNull(graph, "Graph is required");
            Validate.notNull(runtime, "Runtime is required");
            Validate.notNull(portAllocator, "Port range or allocator is required");

            return new ServiceNetwork(this);
        }
    }
}

package ir.sahab.rpcnetwork;

/**
 * Thrown by {@link NetworkOrchestrator#createAndRun(ServiceGraph)} when one of the services can not be started. The
 * services started before it keep running: they are reachable through {@link #getPartialNetwork()} and it is up to the
 * caller to tear them down using {@link NetworkOrchestrator#tearDown(RunningNetwork)}.
 */
public class ServiceStartException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int serviceId;
    private final transient RunningNetwork partialNetwork;

    public ServiceStartException(int serviceId, RunningNetwork partialNetwork, Throwable cause) {
        super(String.format("Could not start service %d, %d service(s) started before it are still running",
                serviceId, partialNetwork.size()), cause);
        this.serviceId = serviceId;
        this.partialNetwork = partialNetwork;
    }

    /**
     * Returns the id of the service which failed to start.
     */
    public int getServiceId() {
        return serviceId;
    }

    /**
     * Returns the services started before the failure. The failed service is not part of it.
     */
    public RunningNetwork getPartialNetwork() {
        return partialNetwork;
    }
}

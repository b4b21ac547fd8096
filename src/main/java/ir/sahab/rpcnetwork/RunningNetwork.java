package ir.sahab.rpcnetwork;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * The services of a {@link ServiceGraph} whose containers are started, in the order they were started.
 * <p>A network returned by {@link NetworkOrchestrator#createAndRun(ServiceGraph)} holds every service of its graph.
 * The partial network of a {@link ServiceStartException} only holds those started before the failure.</p>
 */
public class RunningNetwork {

    private final Map<Integer, RunningService> servicesById;
    private final Set<Integer> terminalServiceIds;
    private final boolean complete;

    /**
     * @param servicesById the running services, in start order.
     * @param terminalServiceIds terminal services of the source graph.
     * @param complete whether every service of the source graph is running.
     */
    RunningNetwork(Map<Integer, RunningService> servicesById, Set<Integer> terminalServiceIds, boolean complete) {
        this.servicesById = ImmutableMap.copyOf(servicesById);
        // A partial network only reports the terminal services it actually contains
        ImmutableSet.Builder<Integer> terminals = ImmutableSet.builder();
        for (Integer serviceId : terminalServiceIds) {
            if (this.servicesById.containsKey(serviceId)) {
                terminals.add(serviceId);
            }
        }
        this.terminalServiceIds = terminals.build();
        this.complete = complete;
    }

    /**
     * Returns the running service with the given id.
     *
     * @throws NoSuchElementException if no service with this id is running in this network.
     */
    public RunningService getService(int serviceId) {
        RunningService service = servicesById.get(serviceId);
        if (service == null) {
            throw new NoSuchElementException("No running service with id " + serviceId);
        }
        return service;
    }

    public boolean hasService(int serviceId) {
        return servicesById.containsKey(serviceId);
    }

    /**
     * Returns an unmodifiable list of all services, in the order they were started.
     */
    public List<RunningService> getAllServices() {
        return Collections.unmodifiableList(new ArrayList<>(servicesById.values()));
    }

    /**
     * Returns the ids of the services no other service depends on. The network is ready once all of them are live.
     */
    public Set<Integer> getTerminalServiceIds() {
        return terminalServiceIds;
    }

    /**
     * Returns true if every service of the source graph is running, false for the partial network of a failed start.
     */
    public boolean isComplete() {
        return complete;
    }

    public int size() {
        return servicesById.size();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("services", servicesById.values())
                .append("terminalServiceIds", terminalServiceIds)
                .append("complete", complete)
                .toString();
    }
}

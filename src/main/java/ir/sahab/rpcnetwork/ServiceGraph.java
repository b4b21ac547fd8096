package ir.sahab.rpcnetwork;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * An immutable description of a network of services and the dependencies between them. Each service is identified by
 * the integer id its {@link Builder} assigned to it.
 * <p>The start order of the graph lists every service after all of its dependencies. The terminal services are those
 * no other service depends on: they are the last ones to start and once all of them are live, the whole network is
 * ready.</p>
 */
public class ServiceGraph {

    private final Map<Integer, ServiceDefinition> definitions;
    private final Map<Integer, Set<Integer>> dependencies;
    private final List<Integer> startOrder;
    private final Set<Integer> terminalServiceIds;

    private ServiceGraph(Map<Integer, ServiceDefinition> definitions, Map<Integer, Set<Integer>> dependencies,
            List<Integer> startOrder, Set<Integer> terminalServiceIds) {
        this.definitions = definitions;
        this.dependencies = dependencies;
        this.startOrder = startOrder;
        this.terminalServiceIds = terminalServiceIds;
    }

    /**
     * Returns a new, empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws NoSuchElementException if no service with the given id is in this graph.
     */
    public ServiceDefinition getDefinition(int serviceId) {
        ServiceDefinition definition = definitions.get(serviceId);
        if (definition == null) {
            throw new NoSuchElementException("No service with id " + serviceId + " in the graph");
        }
        return definition;
    }

    /**
     * Returns the ids of the services the given service depends on.
     *
     * @throws NoSuchElementException if no service with the given id is in this graph.
     */
    public Set<Integer> getDependencies(int serviceId) {
        Set<Integer> result = dependencies.get(serviceId);
        if (result == null) {
            throw new NoSuchElementException("No service with id " + serviceId + " in the graph");
        }
        return result;
    }

    /**
     * Returns all service ids, each one after all of its dependencies.
     */
    public List<Integer> getStartOrder() {
        return startOrder;
    }

    public Set<Integer> getTerminalServiceIds() {
        return terminalServiceIds;
    }

    public int size() {
        return startOrder.size();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("dependencies", dependencies)
                .append("startOrder", startOrder)
                .append("terminalServiceIds", terminalServiceIds)
                .toString();
    }

    /**
     * Accumulates the services of a graph. A service can only depend on services added before it, so the order of
     * {@link #addService(ServiceDefinition, Set)} calls is already a valid start order and no cycle can ever be
     * declared.
     * <p>A builder is not thread-safe.</p>
     */
    public static class Builder {

        private final Map<Integer, ServiceDefinition> definitions = new HashMap<>();
        private final Map<Integer, Set<Integer>> dependencies = new HashMap<>();
        private final List<Integer> startOrder = new ArrayList<>();
        private final Set<Integer> terminalServiceIds = new LinkedHashSet<>();
        private int nextServiceId = 0;

        Builder() {
        }

        /**
         * Adds a service to the graph.
         *
         * @param definition the service to add.
         * @param dependencies ids of the services which must be started before this one, each returned by a previous
         *      call to this method. Use an empty set for a service without dependencies.
         * @return the id of the added service, to be used in the dependencies of later services.
         * @throws InvalidDependencyException if dependencies is null or refers to a service not added yet. In this
         *      case the builder is left untouched and no id is consumed.
         * @throws NullPointerException if definition is null, again without consuming an id.
         */
        public int addService(ServiceDefinition definition, Set<Integer> dependencies) {
            Validate.notNull(definition, "Service definition can not be null");
            if (dependencies == null) {
                throw new InvalidDependencyException(
                        "Dependencies set was null, use an empty set to specify no dependencies");
            }
            // Copy first, so the caller can't change what we validated
            Set<Integer> dependenciesCopy = new LinkedHashSet<>(dependencies);
            for (Integer dependencyId : dependenciesCopy) {
                if (dependencyId == null || !definitions.containsKey(dependencyId)) {
                    throw new InvalidDependencyException("Declared a dependency on " + dependencyId
                            + " but no service with this id has been registered");
                }
            }

            int serviceId = nextServiceId++;
            this.definitions.put(serviceId, definition);
            this.dependencies.put(serviceId, dependenciesCopy);
            startOrder.add(serviceId);
            terminalServiceIds.add(serviceId);
            // A dependency is never terminal. Removing is safe even if another service already depends on it.
            terminalServiceIds.removeAll(dependenciesCopy);
            return serviceId;
        }

        /**
         * Builds an immutable snapshot of the services added so far. Can be called several times; adding services
         * afterwards does not affect the graphs built before.
         */
        public ServiceGraph build() {
            ImmutableMap.Builder<Integer, Set<Integer>> dependenciesCopy = ImmutableMap.builder();
            for (Integer serviceId : startOrder) {
                dependenciesCopy.put(serviceId, ImmutableSet.copyOf(dependencies.get(serviceId)));
            }
            return new ServiceGraph(
                    ImmutableMap.copyOf(definitions),
                    dependenciesCopy.build(),
                    ImmutableList.copyOf(startOrder),
                    ImmutableSet.copyOf(terminalServiceIds));
        }
    }
}

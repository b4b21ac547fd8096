package ir.sahab.rpcnetwork;

import java.util.List;
import java.util.Map;

/**
 * Describes how to run one logical JSON-RPC service as a docker container. Implementations are owned by the caller and
 * are only read by the orchestration code, so they should not change once added to a {@link ServiceGraph.Builder}.
 */
public interface ServiceDefinition {

    /**
     * Returns the docker image of this service, e.g. {@code "avaplatform/gecko:v0.2.0"}.
     */
    String getImage();

    /**
     * Returns the container-internal port on which the service answers JSON-RPC requests.
     */
    int getJsonRpcPort();

    /**
     * Returns the other container-internal ports of the service, in the order their host ports are leased. Never null.
     */
    List<Integer> getOtherPorts();

    /**
     * Returns the request which answers successfully once this service is live.
     */
    JsonRpcRequest getLivenessRequest();

    /**
     * Renders the command the container of this service is started with.
     *
     * @param hostname the hostname the container of this service gets inside the network.
     * @param dependencyLivenessRequests for each dependency of this service, its socket mapped to the request which
     *      tells whether it is live. Empty when the service has no dependency.
     * @return the command tokens, passed as-is to the container runtime.
     */
    List<String> getStartCommand(String hostname, Map<ServiceSocket, JsonRpcRequest> dependencyLivenessRequests);
}

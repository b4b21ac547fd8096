package ir.sahab.rpcnetwork;

/**
 * The container engine on which the services of a network run. All methods block until the engine answers.
 */
public interface ContainerRuntime {

    /**
     * Creates a container as described and starts it.
     *
     * @return the id of the started container.
     * @throws ContainerLaunchException if the container could not be created or started.
     */
    String createAndStart(ContainerConfig config) throws ContainerLaunchException;

    /**
     * Returns the IP address of the given container inside its docker network.
     *
     * @throws ContainerInspectException if the address can not be determined.
     */
    String inspectIpAddress(String containerId) throws ContainerInspectException;

    /**
     * Stops the given container and removes it.
     *
     * @throws ContainerTeardownException if the container could not be removed.
     */
    void stopAndRemove(String containerId) throws ContainerTeardownException;
}

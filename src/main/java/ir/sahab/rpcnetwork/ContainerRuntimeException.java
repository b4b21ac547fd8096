package ir.sahab.rpcnetwork;

/**
 * Base class of failures reported by a {@link ContainerRuntime}.
 */
public class ContainerRuntimeException extends Exception {

    private static final long serialVersionUID = 1L;

    // The container id, or the hostname if the container has no id yet
    private final String container;

    public ContainerRuntimeException(String container, String message, Throwable cause) {
        super(message, cause);
        this.container = container;
    }

    /**
     * Returns the id of the failed container, or its hostname if the failure happened before it got an id.
     */
    public String getContainer() {
        return container;
    }
}

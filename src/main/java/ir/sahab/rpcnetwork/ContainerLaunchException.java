package ir.sahab.rpcnetwork;

/**
 * Thrown when a container can not be created or started.
 */
public class ContainerLaunchException extends ContainerRuntimeException {

    private static final long serialVersionUID = 1L;

    public ContainerLaunchException(String container, String message, Throwable cause) {
        super(container, message, cause);
    }
}

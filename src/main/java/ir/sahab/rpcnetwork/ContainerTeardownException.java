package ir.sahab.rpcnetwork;

/**
 * Thrown when a container can not be stopped or removed. When a whole network is torn down, the first failure is
 * thrown and the others are attached to it as suppressed exceptions.
 */
public class ContainerTeardownException extends ContainerRuntimeException {

    private static final long serialVersionUID = 1L;

    public ContainerTeardownException(String container, String message, Throwable cause) {
        super(container, message, cause);
    }
}

package ir.sahab.rpcnetwork;

/**
 * Thrown when the network address of a started container can not be determined.
 */
public class ContainerInspectException extends ContainerRuntimeException {

    private static final long serialVersionUID = 1L;

    public ContainerInspectException(String container, String message, Throwable cause) {
        super(container, message, cause);
    }
}

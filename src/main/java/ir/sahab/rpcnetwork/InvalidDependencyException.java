package ir.sahab.rpcnetwork;

/**
 * Thrown when a service is added to a {@link ServiceGraph.Builder} with a dependency on a service which is not
 * registered yet, or without a dependency set at all.
 */
public class InvalidDependencyException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidDependencyException(String message) {
        super(message);
    }
}

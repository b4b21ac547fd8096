package ir.sahab.rpcnetwork;

/**
 * Thrown by {@link PortAllocator#lease()} when all ports of its range are leased.
 */
public class PortRangeExhaustedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public PortRangeExhaustedException(int rangeStart, int rangeEnd) {
        super(String.format("There are no more free ports available in the host port range [%d, %d]",
                rangeStart, rangeEnd));
    }
}

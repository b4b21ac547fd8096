package ir.sahab.rpcnetwork;

import java.util.BitSet;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Hands out host ports of a fixed range so that the containers of one or more networks never bind the same host port.
 * A leased port is owned by its holder until it is released.
 * <p>This class is thread-safe: lease and release are serialized on the allocator, so several orchestrations sharing
 * one allocator never get the same port. No ordering is guaranteed on the returned ports.</p>
 */
public class PortAllocator {

    private final int rangeStart;
    private final int rangeEnd;
    // Bit i is set iff port rangeStart + i is leased
    private final BitSet leased;
    // Index of the next port to try, so released ports are not handed out again right away
    private int cursor;

    /**
     * @param rangeStart the first port of the range, inclusive.
     * @param rangeEnd the last port of the range, inclusive.
     */
    public PortAllocator(int rangeStart, int rangeEnd) {
        Validate.inclusiveBetween(1, 65535, rangeStart, "Invalid range start: %d", rangeStart);
        Validate.inclusiveBetween(1, 65535, rangeEnd, "Invalid range end: %d", rangeEnd);
        Validate.isTrue(rangeStart <= rangeEnd, "Range start %d is after range end %d", rangeStart, rangeEnd);

        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.leased = new BitSet(size());
        this.cursor = 0;
    }

    /**
     * Leases a free port of the range.
     *
     * @throws PortRangeExhaustedException if all ports of the range are leased.
     */
    public synchronized int lease() {
        int index = leased.nextClearBit(cursor);
        if (index >= size()) {
            // Wrap around
            index = leased.nextClearBit(0);
        }
        if (index >= size()) {
            throw new PortRangeExhaustedException(rangeStart, rangeEnd);
        }
        leased.set(index);
        cursor = (index + 1) % size();
        return rangeStart + index;
    }

    /**
     * Releases the given port so it can be leased again. Releasing a port which is not leased (or not even in the
     * range) has no effect.
     */
    public synchronized void release(int port) {
        if (inRange(port)) {
            leased.clear(port - rangeStart);
        }
    }

    public synchronized boolean isLeased(int port) {
        return inRange(port) && leased.get(port - rangeStart);
    }

    /**
     * Returns the number of ports which can currently be leased.
     */
    public synchronized int getAvailableCount() {
        return size() - leased.cardinality();
    }

    public int getRangeStart() {
        return rangeStart;
    }

    public int getRangeEnd() {
        return rangeEnd;
    }

    private boolean inRange(int port) {
        return port >= rangeStart && port <= rangeEnd;
    }

    private int size() {
        return rangeEnd - rangeStart + 1;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("rangeStart", rangeStart)
                .append("rangeEnd", rangeEnd)
                .append("available", getAvailableCount())
                .toString();
    }
}

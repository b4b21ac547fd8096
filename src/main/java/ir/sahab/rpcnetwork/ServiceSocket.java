package ir.sahab.rpcnetwork;

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * The address and port on which a service is reachable from the other containers of the network.
 */
public class ServiceSocket {

    private final String address;
    private final int port;

    /**
     * @param address hostname or IP of the service inside the container network.
     * @param port the container-internal port.
     */
    public ServiceSocket(String address, int port) {
        Validate.notEmpty(address, "Address can not be empty");
        Validate.inclusiveBetween(1, 65535, port, "Invalid port: %d", port);

        this.address = address;
        this.port = port;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ServiceSocket)) {
            return false;
        }
        ServiceSocket other = (ServiceSocket) obj;
        return new EqualsBuilder()
                .append(address, other.address)
                .append(port, other.port)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder()
                .append(address)
                .append(port)
                .toHashCode();
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}

package ir.sahab.rpcnetwork;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Everything a {@link ContainerRuntime} needs to create and start the container of one service.
 */
public class ContainerConfig {

    private final String hostname;
    private final String image;
    private final List<String> command;
    private final Map<Integer, Integer> portBindings;  // Internal port to host port

    /**
     * @param hostname the hostname of the container inside the docker network.
     * @param image the docker image to run.
     * @param command the command tokens the container is started with.
     * @param portBindings mapping from each exposed container-internal port to the host port it is published on, in
     *      the order the ports are declared.
     */
    public ContainerConfig(String hostname, String image, List<String> command, Map<Integer, Integer> portBindings) {
        Validate.notEmpty(hostname, "Hostname can not be empty");
        Validate.notEmpty(image, "Image can not be empty");
        Validate.notNull(command, "Command can not be null");
        Validate.notNull(portBindings, "Port bindings can not be null");

        this.hostname = hostname;
        this.image = image;
        this.command = List.copyOf(command);
        this.portBindings = Collections.unmodifiableMap(new LinkedHashMap<>(portBindings));
    }

    public String getHostname() {
        return hostname;
    }

    public String getImage() {
        return image;
    }

    public List<String> getCommand() {
        return command;
    }

    /**
     * Returns the container-internal ports to expose, in declaration order.
     */
    public List<Integer> getExposedPorts() {
        return List.copyOf(portBindings.keySet());
    }

    public Map<Integer, Integer> getPortBindings() {
        return portBindings;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("hostname", hostname)
                .append("image", image)
                .append("command", command)
                .append("portBindings", portBindings)
                .toString();
    }
}

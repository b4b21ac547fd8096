package ir.sahab.rpcnetwork;

import com.google.common.net.InetAddresses;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.InvalidExitValueException;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;

/**
 * A {@link ContainerRuntime} which calls the docker CLI.
 * <p>The docker utility is called by its name (unless another binary is configured) so the environment must be
 * properly set up for it to work without sudo. Use {@link #checkEnvironment()} to fail early when it is not.</p>
 * <p>Containers only resolve each other by hostname on a user-defined docker network, so set one with
 * {@link Builder#network(String)} when start commands refer to their dependencies by hostname.</p>
 */
public class DockerCliRuntime implements ContainerRuntime {

    private static final Logger logger = LoggerFactory.getLogger(DockerCliRuntime.class);

    private final String dockerBinary;
    private final String bindIp;
    private final String network;
    private final Map<String, String> environment;

    private DockerCliRuntime(Builder builder) {
        this.dockerBinary = builder.dockerBinary;
        this.bindIp = builder.bindIp;
        this.network = builder.network;
        this.environment = new HashMap<>(builder.environment);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String createAndStart(ContainerConfig config) throws ContainerLaunchException {
        Validate.notNull(config, "Container config is required");

        String containerId;
        try {
            containerId = execute(createCommand(config)).outputUTF8().trim();
        } catch (InvalidExitValueException | IllegalStateException e) {
            throw new ContainerLaunchException(config.getHostname(),
                    "Could not create docker container from image " + config.getImage(), e);
        }
        if (StringUtils.isEmpty(containerId)) {
            throw new ContainerLaunchException(config.getHostname(),
                    "Docker did not report the id of the container created from image " + config.getImage(), null);
        }

        try {
            execute(command("start", containerId));
        } catch (InvalidExitValueException | IllegalStateException e) {
            ContainerLaunchException failure = new ContainerLaunchException(containerId,
                    "Could not start docker container from image " + config.getImage(), e);
            // The caller never learns the id, so the created container must not outlive this call
            try {
                stopAndRemove(containerId);
            } catch (ContainerTeardownException removeFailure) {
                logger.warn("Could not remove container {} which failed to start.", containerId, removeFailure);
                failure.addSuppressed(removeFailure);
            }
            throw failure;
        }
        return containerId;
    }

    @Override
    public String inspectIpAddress(String containerId) throws ContainerInspectException {
        String output;
        try {
            output = execute(inspectCommand(containerId)).outputUTF8();
        } catch (InvalidExitValueException | IllegalStateException e) {
            throw new ContainerInspectException(containerId, "Could not inspect container " + containerId, e);
        }
        return parseIpAddress(containerId, output);
    }

    @Override
    public void stopAndRemove(String containerId) throws ContainerTeardownException {
        try {
            execute(command("rm", "-f", containerId));
        } catch (InvalidExitValueException | IllegalStateException e) {
            throw new ContainerTeardownException(containerId, "Could not remove container " + containerId, e);
        }
    }

    /**
     * Checks that the docker utility is accessible and throws exception if it can not be used.
     */
    public void checkEnvironment() {
        try {
            execute(command("info"));
        } catch (Exception e) {
            throw new IllegalStateException("It seems your environment is not properly setup. "
                    + "Check " + dockerBinary + " info can be run properly.", e);
        }
    }

    /**
     * Builds the "{@code docker create}" command of the given container. Each exposed port is published on the host
     * port it is bound to.
     */
    List<String> createCommand(ContainerConfig config) {
        List<String> cmds = command("create", "--hostname", config.getHostname());
        if (network != null) {
            cmds.add("--network");
            cmds.add(network);
            // Docker DNS resolves container names and aliases, not hostnames
            cmds.add("--network-alias");
            cmds.add(config.getHostname());
        }
        for (Integer internalPort : config.getExposedPorts()) {
            cmds.add("--expose");
            cmds.add(internalPort + "/tcp");
        }
        for (Map.Entry<Integer, Integer> binding : config.getPortBindings().entrySet()) {
            cmds.add("-p");
            cmds.add(String.format("%s:%d:%d/tcp", bindIp, binding.getValue(), binding.getKey()));
        }
        cmds.add(config.getImage());
        cmds.addAll(config.getCommand());
        return cmds;
    }

    /**
     * The IP can be found in the JSON output of "{@code docker inspect}" command. With a configured network it is the
     * IP on that network. Otherwise the container is expected to be attached to exactly one network (docker's default
     * bridge) and its IP is read from {{range .NetworkSettings.Networks}}{{.IPAddress}}{{end}}, which would
     * concatenate the IPs of several networks.
     */
    List<String> inspectCommand(String containerId) {
        String template = network != null
                ? String.format("{{(index .NetworkSettings.Networks \"%s\").IPAddress}}", network)
                : "{{range .NetworkSettings.Networks}}{{.IPAddress}}{{end}}";
        return command("inspect", "-f", template, containerId);
    }

    static String parseIpAddress(String containerId, String inspectOutput) throws ContainerInspectException {
        String ipAddress = StringUtils.trimToEmpty(inspectOutput);
        if (ipAddress.isEmpty()) {
            throw new ContainerInspectException(containerId, "Container " + containerId
                    + " has no IP address. This is mostly due to your container is terminated early.", null);
        }
        if (!InetAddresses.isInetAddress(ipAddress)) {
            throw new ContainerInspectException(containerId,
                    "Unexpected output of docker inspect for container " + containerId + ": " + ipAddress, null);
        }
        return ipAddress;
    }

    private List<String> command(String... args) {
        List<String> cmds = new ArrayList<>();
        cmds.add(dockerBinary);
        cmds.addAll(Arrays.asList(args));
        return cmds;
    }

    /**
     * Executes the given commands and ensures that the process exited with 0.
     *
     * @throws InvalidExitValueException when the commands exit with non-zero value
     * @throws IllegalStateException if the commands is not executed properly or being interrupted in the mean time.
     */
    private ProcessResult execute(List<String> commands) {
        String command = String.join(" ", commands);
        ProcessResult result;
        try {
            result = new ProcessExecutor()
                    .environment(environment)
                    .command(commands)
                    .readOutput(true)
                    .exitValue(0)
                    .execute();
        } catch (InvalidExitValueException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running command " + command, e);
        } catch (Exception e) {
            // This is not a retryable case since mostly is due to os/security/disk problems.
            throw new IllegalStateException("Fundamental error during running command " + command, e);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Command {} resulted to {}.", command, result.outputUTF8());
        }
        return result;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("dockerBinary", dockerBinary)
                .append("bindIp", bindIp)
                .append("network", network)
                .append("environment", environment)
                .toString();
    }

    public static class Builder {

        private String dockerBinary = "docker";
        private String bindIp = "0.0.0.0";
        private String network;
        private final Map<String, String> environment = new HashMap<>();

        Builder() {
        }

        /**
         * Sets the docker executable, "docker" by default.
         */
        public Builder dockerBinary(String dockerBinary) {
            Validate.notEmpty(dockerBinary, "Docker binary must not be empty");

            this.dockerBinary = dockerBinary;
            return this;
        }

        /**
         * Sets the host IP the leased host ports are bound on, "0.0.0.0" (all interfaces) by default.
         */
        public Builder bindIp(String bindIp) {
            Validate.isTrue(InetAddresses.isInetAddress(bindIp), "Invalid bind IP: %s", bindIp);

            this.bindIp = bindIp;
            return this;
        }

        /**
         * Attaches the containers to the given existing docker network. By default containers join docker's default
         * bridge network.
         */
        public Builder network(String network) {
            Validate.notEmpty(network, "Network name must not be empty");

            this.network = network;
            return this;
        }

        /**
         * Adds the given environment variable to the docker processes, e.g. DOCKER_HOST.
         */
        public Builder environment(String name, String value) {
            Validate.notEmpty(name, "Variable name must not be empty");

            environment.put(name, value);
            return this;
        }

        public DockerCliRuntime build() {
            return new DockerCliRuntime(this);
        }
    }
}

package ir.sahab.rpcnetwork;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a made up JSON-RPC network which renders its dependencies as "--bootstrap" arguments and remembers what it
 * was rendered with.
 */
class TestServiceDefinition implements ServiceDefinition {

    static final int RPC_PORT = 9650;
    static final int STAKING_PORT = 9651;

    private final String name;
    private final List<Integer> otherPorts;
    final List<Map<ServiceSocket, JsonRpcRequest>> renderedWith = new ArrayList<>();
    private boolean failRender = false;

    TestServiceDefinition(String name) {
        this(name, STAKING_PORT);
    }

    TestServiceDefinition(String name, Integer... otherPorts) {
        this.name = name;
        this.otherPorts = Arrays.asList(otherPorts);
    }

    TestServiceDefinition failRender() {
        this.failRender = true;
        return this;
    }

    @Override
    public String getImage() {
        return "test/" + name + ":latest";
    }

    @Override
    public int getJsonRpcPort() {
        return RPC_PORT;
    }

    @Override
    public List<Integer> getOtherPorts() {
        return otherPorts;
    }

    @Override
    public JsonRpcRequest getLivenessRequest() {
        return new JsonRpcRequest(name + ".isBootstrapped");
    }

    @Override
    public List<String> getStartCommand(String hostname, Map<ServiceSocket, JsonRpcRequest> dependencyLivenessRequests) {
        if (failRender) {
            throw new IllegalStateException("Could not render command of " + name);
        }
        renderedWith.add(new LinkedHashMap<>(dependencyLivenessRequests));
        List<String> command = new ArrayList<>();
        command.add("/node");
        command.add("--public-ip=" + hostname);
        for (ServiceSocket socket : dependencyLivenessRequests.keySet()) {
            command.add("--bootstrap=" + socket);
        }
        return command;
    }

    @Override
    public String toString() {
        return name;
    }
}

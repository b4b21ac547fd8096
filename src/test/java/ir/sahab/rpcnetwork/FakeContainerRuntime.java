package ir.sahab.rpcnetwork;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An in-memory container runtime which records what it is asked to do. It can be told to fail on the n-th launch or
 * inspect and on the teardown of given containers.
 */
class FakeContainerRuntime implements ContainerRuntime {

    final List<ContainerConfig> launched = new ArrayList<>();
    final List<String> removed = new ArrayList<>();
    final Set<String> running = new HashSet<>();

    private int failLaunchNumber = -1;
    private int failInspectNumber = -1;
    private final Set<String> failTeardownOf = new HashSet<>();
    private int inspects = 0;

    /**
     * Fails the n-th (one-based) call to createAndStart.
     */
    FakeContainerRuntime failLaunch(int number) {
        this.failLaunchNumber = number;
        return this;
    }

    /**
     * Fails the n-th (one-based) call to inspectIpAddress.
     */
    FakeContainerRuntime failInspect(int number) {
        this.failInspectNumber = number;
        return this;
    }

    FakeContainerRuntime failTeardown(String containerId) {
        failTeardownOf.add(containerId);
        return this;
    }

    static String containerId(int launchNumber) {
        return "container-" + launchNumber;
    }

    @Override
    public String createAndStart(ContainerConfig config) throws ContainerLaunchException {
        if (launched.size() + 1 == failLaunchNumber) {
            throw new ContainerLaunchException(config.getHostname(), "Launch failed on purpose", null);
        }
        launched.add(config);
        String containerId = containerId(launched.size());
        running.add(containerId);
        return containerId;
    }

    @Override
    public String inspectIpAddress(String containerId) throws ContainerInspectException {
        inspects++;
        if (inspects == failInspectNumber) {
            throw new ContainerInspectException(containerId, "Inspect failed on purpose", null);
        }
        return "172.17.0." + containerId.substring("container-".length());
    }

    @Override
    public void stopAndRemove(String containerId) throws ContainerTeardownException {
        if (failTeardownOf.contains(containerId)) {
            throw new ContainerTeardownException(containerId, "Teardown failed on purpose", null);
        }
        removed.add(containerId);
        running.remove(containerId);
    }
}

package ir.sahab.rpcnetwork;

/**
 * Called after all containers of a network are started. Note that in this state, only the containers are started and
 * the services themselves might not be live yet. You can use this callback for waiting for your services to become
 * live or do any initialization stuff.
 */
public interface StartupCallback {

    /**
     * Called after containers of all services are started.
     *
     * @param network the started network.
     * @throws Exception if thrown, the startup process will be failed.
     */
    void process(RunningNetwork network) throws Exception;
}

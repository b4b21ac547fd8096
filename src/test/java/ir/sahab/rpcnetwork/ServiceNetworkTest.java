package ir.sahab.rpcnetwork;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Applies the rule around a statement, the way junit does for a test class annotated with it.
 */
public class ServiceNetworkTest {

    private final FakeContainerRuntime runtime = new FakeContainerRuntime();
    private final PortAllocator portAllocator = new PortAllocator(45000, 45099);

    private static ServiceGraph chain() {
        ServiceGraph.Builder builder = ServiceGraph.builder();
        int a = builder.addService(new TestServiceDefinition("a"), Collections.emptySet());
        int b = builder.addService(new TestServiceDefinition("b"), Set.of(a));
        builder.addService(new TestServiceDefinition("c"), Set.of(b));
        return builder.build();
    }

    private static void run(ServiceNetwork rule, Statement statement) throws Throwable {
        rule.apply(statement, Description.EMPTY).evaluate();
    }

    @Test
    public void testNetworkIsRunningDuringTest() throws Throwable {
        List<Integer> seenByCallback = new ArrayList<>();
        ServiceNetwork rule = ServiceNetwork.builder()
                .graph(chain())
                .runtime(runtime)
                .portAllocator(portAllocator)
                .hostnamePrefix("node-")
                .afterStart(network -> seenByCallback.addAll(network.getTerminalServiceIds()))
                .forceDown()
                .build();

        run(rule, new Statement() {
            @Override
            public void evaluate() {
                assertThat(rule.getNetwork().isComplete()).isTrue();
                assertThat(rule.getService(0).getHostname()).isEqualTo("node-0");
                assertThat(runtime.running).hasSize(3);
            }
        });

        assertThat(seenByCallback).containsExactly(2);
        // Forced down after the test
        assertThat(runtime.running).isEmpty();
        assertThat(portAllocator.getAvailableCount()).isEqualTo(100);
        assertThatThrownBy(rule::getNetwork).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testNetworkKeepsRunningWithoutForceDown() throws Throwable {
        ServiceNetwork rule = ServiceNetwork.builder()
                .graph(chain())
                .runtime(runtime)
                .portRange(45000, 45099)
                .build();

        run(rule, new Statement() {
            @Override
            public void evaluate() {
                assertThat(rule.getNetwork().size()).isEqualTo(3);
            }
        });

        assertThat(runtime.running).hasSize(3);
        assertThat(runtime.removed).isEmpty();
    }

    @Test
    public void testFailedStartRemovesPartialNetwork() {
        runtime.failLaunch(3);
        ServiceNetwork rule = ServiceNetwork.builder()
                .graph(chain())
                .runtime(runtime)
                .portAllocator(portAllocator)
                .build();

        assertThatThrownBy(() -> run(rule, new Statement() {
            @Override
            public void evaluate() {
                throw new AssertionError("Test must not run on a broken network");
            }
        })).isInstanceOf(ServiceStartException.class);

        assertThat(runtime.launched).hasSize(2);
        assertThat(runtime.running).isEmpty();
        assertThat(portAllocator.getAvailableCount()).isEqualTo(100);
    }

    @Test
    public void testFailedCallbackRemovesNetwork() {
        List<String> called = new ArrayList<>();
        ServiceNetwork rule = ServiceNetwork.builder()
                .graph(chain())
                .runtime(runtime)
                .portAllocator(portAllocator)
                .afterStart(network -> {
                    called.add("first");
                    throw new java.io.IOException("Service 2 is not live");
                })
                .afterStart(network -> called.add("second"))
                .build();

        assertThatThrownBy(() -> run(rule, new Statement() {
            @Override
            public void evaluate() {
                throw new AssertionError("Test must not run on a broken network");
            }
        })).isInstanceOf(java.io.IOException.class).hasMessageContaining("not live");

        assertThat(called).containsExactly("first");
        assertThat(runtime.running).isEmpty();
    }

    @Test
    public void testBuilderRequiresGraphRuntimeAndPorts() {
        assertThatThrownBy(() -> ServiceNetwork.builder().runtime(runtime).portAllocator(portAllocator).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Graph");
        assertThatThrownBy(() -> ServiceNetwork.builder().graph(chain()).portAllocator(portAllocator).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Runtime");
        assertThatThrownBy(() -> ServiceNetwork.builder().graph(chain()).runtime(runtime).build())
                .isInstanceOf(NullPointerException.class);
    }
}

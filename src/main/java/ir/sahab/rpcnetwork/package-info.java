/**
 * This package starts a network of inter-dependent JSON-RPC services as docker containers, typically as the test
 * environment of a blockchain or other peer-to-peer client. Describe the services and their dependencies with a
 * {@link ir.sahab.rpcnetwork.ServiceGraph} and start it with a {@link ir.sahab.rpcnetwork.NetworkOrchestrator}, or add
 * a {@link ir.sahab.rpcnetwork.ServiceNetwork} rule to your test. Every service is started after the services it
 * depends on and is told their addresses, so it can wait for them before declaring itself live.
 **/
package ir.sahab.rpcnetwork;

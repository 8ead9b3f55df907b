package io.hearth.cli;

@FunctionalInterface
public interface GatewayRunner {
    int run(int port, String host) throws Exception;
}

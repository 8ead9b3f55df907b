package io.hearth.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Serves profiles, streamed turns and session stats over HTTP until the process is stopped.
 * Port 0 binds an ephemeral port, which the runner reports once the server is listening.
 */
@Command(name = "gateway", description = "Start the HTTP gateway for profiles and streamed turns")
public final class GatewayCommand implements Callable<Integer> {
    private static final int MAX_PORT = 65_535;

    private final CliContext context;

    @Spec
    CommandSpec spec;

    @Option(names = {"--port"}, description = "Listen port, 0 for any free port (default: ${DEFAULT-VALUE})", defaultValue = "8787")
    int port;

    @Option(names = {"--host"}, description = "Bind address (default: ${DEFAULT-VALUE})", defaultValue = "127.0.0.1")
    String host;

    public GatewayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (port < 0 || port > MAX_PORT) {
            throw new ParameterException(spec.commandLine(), "--port must be between 0 and " + MAX_PORT + ", got " + port);
        }
        if (host == null || host.isBlank()) {
            throw new ParameterException(spec.commandLine(), "--host must not be blank");
        }
        try {
            return context.gatewayRunner().run(port, host.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Gateway interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("Gateway command failed: " + e.getMessage());
            return 1;
        }
    }
}

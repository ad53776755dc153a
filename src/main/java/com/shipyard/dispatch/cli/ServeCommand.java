package com.shipyard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: shipyard serve
 * <p>
 * Starts Shipyard as a long-running HTTP server accepting commit events.
 * The web server is enabled by {@link com.shipyard.ShipyardApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli and the banner
 * is printed once the server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Shipyard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached for --help style invocations; CliRunner skips picocli for serve.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Shipyard server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/pipelines");
        System.out.println("  Health:  http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

package com.shipyard.dispatch.cli;

import com.shipyard.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: shipyard health
 * <p>
 * Runs all health checks and displays results with colored output.
 * Exits non-zero when any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return ShipyardCommand.EXIT_FAILED;
        }

        var checks = healthCheckService.checkAll();
        boolean anyDown = false;
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        ConsoleOutput.rule();
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else if (!anyDown) {
            ConsoleOutput.warn("Overall: operational with reduced features");
        } else {
            ConsoleOutput.error("Overall: one or more components down");
        }
        return anyDown ? ShipyardCommand.EXIT_FAILED : ShipyardCommand.EXIT_OK;
    }
}

package com.shipyard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Shipyard.
 * <p>
 * Exit codes: 0 when the run succeeded, 1 when it failed, 2 on usage or
 * configuration errors.
 */
@Command(
        name = "shipyard",
        mixinStandardHelpOptions = true,
        version = "Shipyard 0.1.0",
        description = "Release pipeline orchestrator: test, publish, scan and verify",
        subcommands = {
                RunCommand.class,
                VerifyCommand.class,
                TagsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShipyardCommand implements Runnable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}

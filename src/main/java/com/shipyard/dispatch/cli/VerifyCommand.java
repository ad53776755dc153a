package com.shipyard.dispatch.cli;

import com.shipyard.core.model.DeploymentCheck;
import com.shipyard.core.verify.DeploymentVerifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: shipyard verify --ref R --commit C
 * <p>
 * Pulls the published artifact for a ref and commit and runs the deployment
 * check on it, without running any pipeline.
 */
@Command(name = "verify", mixinStandardHelpOptions = true, description = "Verify a published artifact")
@Component
public class VerifyCommand implements Callable<Integer> {

    @Option(names = {"--ref", "-r"}, description = "Branch or merge ref the artifact was published for")
    private String ref;

    @Option(names = {"--commit", "-c"}, required = true, description = "Commit identifier")
    private String commit;

    private final DeploymentVerifier verifier;

    public VerifyCommand(DeploymentVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        DeploymentCheck check;
        try {
            check = verifier.verify(ref, commit);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ShipyardCommand.EXIT_USAGE;
        }
        ConsoleOutput.deploymentCheck(check);
        return check.passed() ? ShipyardCommand.EXIT_OK : ShipyardCommand.EXIT_FAILED;
    }
}

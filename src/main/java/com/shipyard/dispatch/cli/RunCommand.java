package com.shipyard.dispatch.cli;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.engine.PipelineEngine;
import com.shipyard.core.engine.PipelineRunStore;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.TriggerContext;
import com.shipyard.core.trigger.CrossPipelineTrigger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: shipyard run --ref R --commit C
 * <p>
 * Runs the upstream pipeline for a commit event. On success the downstream
 * pipeline starts automatically unless {@code --no-deploy} is given.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the pipelines for a commit event")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--ref", "-r"}, description = "Branch or merge ref, e.g. main or 2/merge")
    private String ref;

    @Option(names = {"--commit", "-c"}, required = true, description = "Commit identifier")
    private String commit;

    @Option(names = "--change-request", description = "Change request number to report against")
    private Integer changeRequest;

    @Option(names = "--no-deploy", description = "Do not start the downstream pipeline")
    private boolean noDeploy;

    private final PipelineEngine engine;
    private final PipelineRunStore store;
    private final CrossPipelineTrigger trigger;
    private final ShipyardProperties properties;

    public RunCommand(PipelineEngine engine, PipelineRunStore store, CrossPipelineTrigger trigger,
                      ShipyardProperties properties) {
        this.engine = engine;
        this.store = store;
        this.trigger = trigger;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        TriggerContext context;
        try {
            context = TriggerContext.commit(ref, commit).withChangeRequest(changeRequest);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ShipyardCommand.EXIT_USAGE;
        }

        String upstream = properties.getPipeline().getUpstream();
        ConsoleOutput.info("Running " + upstream + " for " + context.refName() + "@" + context.commitId());

        boolean wasEnabled = trigger.isEnabled();
        trigger.setEnabled(!noDeploy);
        PipelineRun ciRun;
        try {
            ciRun = engine.run(upstream, context);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ShipyardCommand.EXIT_USAGE;
        } finally {
            trigger.setEnabled(wasEnabled);
        }

        ConsoleOutput.rule();
        ConsoleOutput.run(ciRun);
        if (ciRun.status() != RunStatus.SUCCESS) {
            return ShipyardCommand.EXIT_FAILED;
        }
        if (noDeploy) {
            ConsoleOutput.info("Downstream pipeline skipped (--no-deploy)");
            return ShipyardCommand.EXIT_OK;
        }

        Optional<PipelineRun> cdRun = downstreamOf(ciRun);
        if (cdRun.isEmpty()) {
            ConsoleOutput.warn("Downstream pipeline did not start for " + ciRun.runId());
            return ShipyardCommand.EXIT_FAILED;
        }
        ConsoleOutput.rule();
        ConsoleOutput.run(cdRun.get());
        return cdRun.get().status() == RunStatus.SUCCESS ? ShipyardCommand.EXIT_OK : ShipyardCommand.EXIT_FAILED;
    }

    private Optional<PipelineRun> downstreamOf(PipelineRun upstreamRun) {
        return store.list().stream()
                .filter(r -> upstreamRun.runId().equals(r.trigger().upstreamRunId()))
                .findFirst();
    }
}

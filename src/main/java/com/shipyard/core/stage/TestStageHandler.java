package com.shipyard.core.stage;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.CommandResult;
import com.shipyard.core.collaborator.CommandRunner;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a lint or test command. Success iff the command exits with status zero.
 * <p>
 * The stage's {@code tool} parameter selects the command; a {@code {runtime}}
 * placeholder in the command is replaced by the stage's {@code runtime} parameter,
 * which is how sibling stages test the same suite across runtime versions.
 */
@Component
public class TestStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(TestStageHandler.class);

    public static final String PARAM_TOOL = "tool";
    public static final String PARAM_RUNTIME = "runtime";
    public static final String TOOL_LINT = "lint";
    public static final String TOOL_TEST = "test";

    private static final int OUTPUT_TAIL_CHARS = 2000;

    private final CommandRunner commandRunner;
    private final Map<String, List<String>> toolCommands;
    private final Path workDir;
    private final Duration timeout;

    @Autowired
    public TestStageHandler(CommandRunner commandRunner, ShipyardProperties properties) {
        this(commandRunner,
                Map.of(TOOL_LINT, properties.getCi().getLintCommand(),
                       TOOL_TEST, properties.getCi().getTestCommand()),
                Path.of(properties.getCi().getWorkspace()),
                properties.getCommandTimeout());
    }

    TestStageHandler(CommandRunner commandRunner, Map<String, List<String>> toolCommands,
                     Path workDir, Duration timeout) {
        this.commandRunner = commandRunner;
        this.toolCommands = Map.copyOf(toolCommands);
        this.workDir = workDir;
        this.timeout = timeout;
    }

    @Override
    public StageKind kind() {
        return StageKind.TEST;
    }

    @Override
    public StageResult handle(Stage stage, StageContext context) {
        Instant startedAt = Instant.now();
        String tool = stage.params().getOrDefault(PARAM_TOOL, TOOL_TEST);
        List<String> template = toolCommands.get(tool);
        if (template == null || template.isEmpty()) {
            throw new IllegalStateException("No command configured for tool '" + tool + "' (stage " + stage.name() + ")");
        }

        String runtime = stage.param(PARAM_RUNTIME);
        List<String> command = resolve(template, runtime);
        var env = new HashMap<String, String>();
        if (runtime != null) {
            env.put("SHIPYARD_RUNTIME", runtime);
        }

        log.info("Stage {} running {}", stage.name(), command);
        CommandResult result = commandRunner.run(command, workDir, env, timeout);

        var payload = new HashMap<String, Object>();
        payload.put("exitCode", result.exitCode());
        payload.put("tool", tool);
        if (runtime != null) {
            payload.put("runtime", runtime);
        }
        TestOutputParser.parse(result.output()).ifPresent(counts -> {
            payload.put("totalTests", counts.total());
            payload.put("failedTests", counts.failed());
        });
        payload.put("output", result.outputTail(OUTPUT_TAIL_CHARS));

        if (result.succeeded()) {
            return StageResult.success(stage, describe(tool, payload), payload, startedAt);
        }
        return StageResult.failure(stage, FailureKind.ASSERTION,
                tool + " exited with status " + result.exitCode(), payload, startedAt);
    }

    static List<String> resolve(List<String> template, String runtime) {
        var command = new ArrayList<String>(template.size());
        for (String part : template) {
            command.add(runtime != null ? part.replace("{runtime}", runtime) : part.replace("{runtime}", ""));
        }
        return command;
    }

    private static String describe(String tool, Map<String, Object> payload) {
        if (payload.containsKey("totalTests")) {
            return payload.get("totalTests") + " tests, " + payload.get("failedTests") + " failed";
        }
        return tool + " passed";
    }
}

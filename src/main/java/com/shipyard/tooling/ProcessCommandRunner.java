package com.shipyard.tooling;

import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.collaborator.CommandResult;
import com.shipyard.core.collaborator.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs tool commands as local processes with stdout and stderr merged.
 * <p>
 * Output goes to a temporary file rather than a pipe so a chatty process can never
 * block on a full buffer while we wait on its timeout.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Path workDir, Map<String, String> env, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
        log.debug("Running: {} (in {})", command, workDir);

        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("shipyard-cmd-", ".log");
            var builder = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            if (env != null) {
                builder.environment().putAll(env);
            }
            process = builder.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CollaboratorException("Command " + command.get(0) + " timed out after "
                        + timeout.toSeconds() + "s");
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            log.debug("{} exited with {}", command.get(0), exitCode);
            return new CommandResult(exitCode, output);
        } catch (IOException e) {
            throw new CollaboratorException("Could not run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new CollaboratorException("Interrupted while running " + command.get(0), e);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}

package com.shipyard.tooling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.collaborator.CommandResult;
import com.shipyard.core.collaborator.CommandRunner;
import com.shipyard.core.collaborator.VulnerabilityScanner;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.Finding;
import com.shipyard.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scans an image with Trivy and reads its JSON report.
 * <p>
 * Trivy's own exit code is left at its default (0 on findings), so a non-zero
 * exit always means the scan itself did not complete.
 */
@Component
public class TrivyScanner implements VulnerabilityScanner {

    private static final Logger log = LoggerFactory.getLogger(TrivyScanner.class);

    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final List<String> baseCommand;
    private final Map<String, String> env;
    private final Duration timeout;

    @Autowired
    public TrivyScanner(CommandRunner commandRunner, ShipyardProperties properties) {
        this(commandRunner, new ObjectMapper(), properties.getCi().getScanCommand(),
                credentials(properties.getRegistry()), properties.getScanTimeout());
    }

    TrivyScanner(CommandRunner commandRunner, ObjectMapper objectMapper, List<String> baseCommand,
                 Map<String, String> env, Duration timeout) {
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        this.baseCommand = List.copyOf(baseCommand);
        this.env = Map.copyOf(env);
        this.timeout = timeout;
    }

    @Override
    public List<Finding> scan(ArtifactTag tag) {
        var command = new ArrayList<>(baseCommand);
        command.add(tag.reference());
        log.info("Scanning {}", tag.reference());

        CommandResult result = commandRunner.run(command, Path.of("."), env, timeout);
        if (!result.succeeded()) {
            throw new CollaboratorException("Scanner exited with status " + result.exitCode()
                    + ": " + result.outputTail(500));
        }
        List<Finding> findings = parse(result.output());
        log.info("Scan of {} found {} vulnerabilities", tag.reference(), findings.size());
        return findings;
    }

    /**
     * Reads {@code Results[].Vulnerabilities[]} from a Trivy JSON report. A report
     * with no results, or results with no vulnerabilities, yields an empty list.
     */
    List<Finding> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Unreadable scanner report: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new CollaboratorException("Scanner produced no report");
        }

        var findings = new ArrayList<Finding>();
        for (JsonNode target : root.path("Results")) {
            for (JsonNode vuln : target.path("Vulnerabilities")) {
                findings.add(new Finding(
                        vuln.path("VulnerabilityID").asText(""),
                        vuln.path("PkgName").asText(""),
                        Severity.parse(vuln.path("Severity").asText(null)),
                        vuln.path("Title").asText("")));
            }
        }
        return findings;
    }

    private static Map<String, String> credentials(ShipyardProperties.Registry registry) {
        var env = new HashMap<String, String>();
        if (registry.getUsername() != null && !registry.getUsername().isBlank()) {
            env.put("TRIVY_USERNAME", registry.getUsername());
            env.put("TRIVY_PASSWORD", registry.getPassword() != null ? registry.getPassword() : "");
        }
        return env;
    }
}

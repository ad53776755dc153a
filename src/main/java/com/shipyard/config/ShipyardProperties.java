package com.shipyard.config;

import com.shipyard.core.model.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "shipyard")
public class ShipyardProperties {

    private Registry registry = new Registry();
    private Tags tags = new Tags();
    private Pipeline pipeline = new Pipeline();
    private Gates gates = new Gates();
    private Timeouts timeouts = new Timeouts();
    private Ci ci = new Ci();
    private Scm scm = new Scm();
    private Docker docker = new Docker();

    // -- Convenience accessors (delegate to nested) --
    public Duration getCommandTimeout() { return Duration.ofSeconds(timeouts.commandSeconds); }
    public Duration getPullTimeout() { return Duration.ofSeconds(timeouts.pullSeconds); }
    public Duration getRunTimeout() { return Duration.ofSeconds(timeouts.runSeconds); }
    public Duration getScanTimeout() { return Duration.ofSeconds(timeouts.scanSeconds); }
    public double getCoverageThreshold() { return gates.coverageThreshold; }
    public Severity getScanSeverityThreshold() { return gates.scanSeverityThreshold; }

    /**
     * Returns true when a token is configured for the change-request host.
     * Without one, reporting is skipped entirely.
     */
    public boolean isScmConfigured() {
        return scm.token != null && !scm.token.isBlank()
                && scm.owner != null && !scm.owner.isBlank()
                && scm.repo != null && !scm.repo.isBlank();
    }

    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Tags getTags() { return tags; }
    public void setTags(Tags tags) { this.tags = tags; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Gates getGates() { return gates; }
    public void setGates(Gates gates) { this.gates = gates; }
    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }
    public Ci getCi() { return ci; }
    public void setCi(Ci ci) { this.ci = ci; }
    public Scm getScm() { return scm; }
    public void setScm(Scm scm) { this.scm = scm; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }

    public static class Registry {
        private String host = "ghcr.io";
        private String namespace = "shipyard";
        private String repository = "sample-app";
        private String username = "";
        private String password = "";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }
        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public static class Tags {
        private int maxLength = 128;
        private String placeholder = "unknown-ref";

        public int getMaxLength() { return maxLength; }
        public void setMaxLength(int maxLength) { this.maxLength = maxLength; }
        public String getPlaceholder() { return placeholder; }
        public void setPlaceholder(String placeholder) { this.placeholder = placeholder; }
    }

    public static class Pipeline {
        private int maxParallel = Runtime.getRuntime().availableProcessors();
        private String upstream = "ci";
        private String downstream = "cd";
        private String runUrlBase = "http://localhost:8080/api/v1/pipelines/";

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public String getUpstream() { return upstream; }
        public void setUpstream(String upstream) { this.upstream = upstream; }
        public String getDownstream() { return downstream; }
        public void setDownstream(String downstream) { this.downstream = downstream; }
        public String getRunUrlBase() { return runUrlBase; }
        public void setRunUrlBase(String runUrlBase) { this.runUrlBase = runUrlBase; }
    }

    public static class Gates {
        private double coverageThreshold = 80.0;
        private Severity scanSeverityThreshold = Severity.HIGH;

        public double getCoverageThreshold() { return coverageThreshold; }
        public void setCoverageThreshold(double coverageThreshold) { this.coverageThreshold = coverageThreshold; }
        public Severity getScanSeverityThreshold() { return scanSeverityThreshold; }
        public void setScanSeverityThreshold(Severity scanSeverityThreshold) { this.scanSeverityThreshold = scanSeverityThreshold; }
    }

    public static class Timeouts {
        private int commandSeconds = 600;
        private int pullSeconds = 300;
        private int runSeconds = 60;
        private int scanSeconds = 600;

        public int getCommandSeconds() { return commandSeconds; }
        public void setCommandSeconds(int commandSeconds) { this.commandSeconds = commandSeconds; }
        public int getPullSeconds() { return pullSeconds; }
        public void setPullSeconds(int pullSeconds) { this.pullSeconds = pullSeconds; }
        public int getRunSeconds() { return runSeconds; }
        public void setRunSeconds(int runSeconds) { this.runSeconds = runSeconds; }
        public int getScanSeconds() { return scanSeconds; }
        public void setScanSeconds(int scanSeconds) { this.scanSeconds = scanSeconds; }
    }

    public static class Ci {
        private String workspace = ".";
        private String buildContext = ".";
        private List<String> runtimes = new ArrayList<>(List.of("3.10", "3.11", "3.12"));
        private List<String> lintCommand = new ArrayList<>(List.of("python3", "-m", "flake8", "."));
        private List<String> testCommand = new ArrayList<>(List.of("python{runtime}", "-m", "pytest", "-q"));
        private List<String> coverageCommand = new ArrayList<>(List.of("python3", "-m", "coverage", "report"));
        private List<String> scanCommand = new ArrayList<>(List.of("trivy", "image", "--format", "json", "--quiet"));

        public String getWorkspace() { return workspace; }
        public void setWorkspace(String workspace) { this.workspace = workspace; }
        public String getBuildContext() { return buildContext; }
        public void setBuildContext(String buildContext) { this.buildContext = buildContext; }
        public List<String> getRuntimes() { return runtimes; }
        public void setRuntimes(List<String> runtimes) { this.runtimes = runtimes; }
        public List<String> getLintCommand() { return lintCommand; }
        public void setLintCommand(List<String> lintCommand) { this.lintCommand = lintCommand; }
        public List<String> getTestCommand() { return testCommand; }
        public void setTestCommand(List<String> testCommand) { this.testCommand = testCommand; }
        public List<String> getCoverageCommand() { return coverageCommand; }
        public void setCoverageCommand(List<String> coverageCommand) { this.coverageCommand = coverageCommand; }
        public List<String> getScanCommand() { return scanCommand; }
        public void setScanCommand(List<String> scanCommand) { this.scanCommand = scanCommand; }
    }

    public static class Scm {
        private String apiUrl = "https://api.github.com";
        private String owner = "";
        private String repo = "";
        private String token = "";

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }
        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
    }

    public static class Docker {
        private String host = "";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
    }
}

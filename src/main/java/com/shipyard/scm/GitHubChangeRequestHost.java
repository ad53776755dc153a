package com.shipyard.scm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shipyard.core.collaborator.ChangeRequestHost;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.model.ChangeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Change requests on GitHub: pull requests, looked up by head commit and commented on
 * through the REST v3 API.
 */
public class GitHubChangeRequestHost implements ChangeRequestHost {

    private static final Logger log = LoggerFactory.getLogger(GitHubChangeRequestHost.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String apiUrl;
    private final String owner;
    private final String repo;
    private final String token;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubChangeRequestHost(String apiUrl, String owner, String repo, String token) {
        this(apiUrl, owner, repo, token,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                new ObjectMapper());
    }

    GitHubChangeRequestHost(String apiUrl, String owner, String repo, String token,
                            HttpClient httpClient, ObjectMapper objectMapper) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.owner = owner;
        this.repo = repo;
        this.token = token;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ChangeRequest> findOpenByHeadCommit(String commitId) {
        JsonNode pulls = get("/repos/" + owner + "/" + repo + "/commits/" + commitId + "/pulls");
        Optional<ChangeRequest> found = parseOpenPulls(pulls, commitId);
        found.ifPresent(cr -> log.debug("Commit {} is the head of #{}", commitId, cr.number()));
        return found;
    }

    @Override
    public void postComment(int changeRequest, String body) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("body", body);
        post("/repos/" + owner + "/" + repo + "/issues/" + changeRequest + "/comments", payload.toString());
        log.info("Commented on {}/{}#{}", owner, repo, changeRequest);
    }

    /**
     * Picks the open pull request whose head is {@code commitId}. The endpoint also
     * returns closed pulls and pulls merely containing the commit; both are ignored.
     */
    static Optional<ChangeRequest> parseOpenPulls(JsonNode pulls, String commitId) {
        if (pulls == null || !pulls.isArray()) {
            return Optional.empty();
        }
        for (JsonNode pull : pulls) {
            if (!"open".equals(pull.path("state").asText())) continue;
            String head = pull.path("head").path("sha").asText("");
            if (!head.isEmpty() && !head.equals(commitId)) continue;
            return Optional.of(new ChangeRequest(
                    pull.path("number").asInt(),
                    head.isEmpty() ? commitId : head,
                    pull.path("html_url").asText(null)));
        }
        return Optional.empty();
    }

    JsonNode get(String path) {
        var request = baseRequest(path).GET().build();
        return send(request, "GET " + path);
    }

    JsonNode post(String path, String body) {
        var request = baseRequest(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return send(request, "POST " + path);
    }

    private HttpRequest.Builder baseRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");
    }

    private JsonNode send(HttpRequest request, String description) {
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new CollaboratorException("GitHub API %s failed (HTTP %d): %s"
                        .formatted(description, response.statusCode(), response.body()));
            }
            String body = response.body();
            return body == null || body.isBlank() ? objectMapper.nullNode() : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("GitHub API returned unreadable JSON for " + description, e);
        } catch (IOException e) {
            throw new CollaboratorException("GitHub API request failed: " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted during GitHub API request: " + description, e);
        }
    }
}

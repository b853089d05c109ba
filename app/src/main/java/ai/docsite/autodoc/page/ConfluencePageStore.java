package ai.docsite.autodoc.page;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PageStore} backed by the Confluence Cloud REST API (v2) using storage-format bodies.
 */
public class ConfluencePageStore implements PageStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfluencePageStore.class);
    private static final String PAGES_PATH = "/wiki/api/v2/pages";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final URI baseUrl;
    private final String authorization;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ConfluencePageStore(URI baseUrl, String email, String apiToken) {
        this(baseUrl, email, apiToken, HttpClient.newHttpClient(), new ObjectMapper());
    }

    public ConfluencePageStore(URI baseUrl, String email, String apiToken,
                               HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(apiToken, "apiToken");
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((email + ":" + apiToken).getBytes(StandardCharsets.UTF_8));
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public String createPage(String spaceId, String title, String content, Optional<String> parentId) {
        requireText(spaceId, "spaceId");
        requireText(title, "title");
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("spaceId", spaceId);
        payload.put("status", "current");
        payload.put("title", title);
        payload.set("body", storageBody(content));
        parentId.filter(id -> !id.isBlank()).ifPresent(id -> payload.put("parentId", id));

        HttpResponse<String> response = send(request(PAGES_PATH)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(write(payload), StandardCharsets.UTF_8))
                .build());
        requireSuccess(response, "create page \"" + title + "\"");
        String pageId = read(response).path("id").asText("");
        if (pageId.isEmpty()) {
            throw new PageStoreException("Confluence did not return an id for page \"" + title + "\"");
        }
        LOGGER.info("Created page {} titled \"{}\" in space {}", pageId, title, spaceId);
        return pageId;
    }

    @Override
    public String updatePage(String pageId, String title, String content, int version) {
        requireText(pageId, "pageId");
        requireText(title, "title");
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", pageId);
        payload.put("status", "current");
        payload.put("title", title);
        payload.set("body", storageBody(content));
        ObjectNode versionNode = payload.putObject("version");
        versionNode.put("number", version + 1);
        versionNode.put("message", "Updated by AutoDoc");

        HttpResponse<String> response = send(request(PAGES_PATH + "/" + encode(pageId))
                .header("Content-Type", "application/json; charset=utf-8")
                .PUT(HttpRequest.BodyPublishers.ofString(write(payload), StandardCharsets.UTF_8))
                .build());
        if (response.statusCode() == 404) {
            throw new PageNotFoundException(pageId);
        }
        if (response.statusCode() == 409) {
            throw new VersionConflictException(pageId, version);
        }
        requireSuccess(response, "update page " + pageId);
        LOGGER.info("Updated page {} to version {}", pageId, version + 1);
        return read(response).path("id").asText(pageId);
    }

    @Override
    public Page getPage(String pageId) {
        requireText(pageId, "pageId");
        HttpResponse<String> response = send(request(PAGES_PATH + "/" + encode(pageId) + "?body-format=storage")
                .GET()
                .build());
        if (response.statusCode() == 404) {
            throw new PageNotFoundException(pageId);
        }
        requireSuccess(response, "get page " + pageId);
        JsonNode node = read(response);
        return new Page(node.path("id").asText(pageId),
                node.path("title").asText(""),
                node.path("version").path("number").asInt(0),
                node.path("body").path("storage").path("value").asText(""));
    }

    @Override
    public Optional<String> findPageByTitle(String spaceId, String title) {
        requireText(spaceId, "spaceId");
        requireText(title, "title");
        String path = "/wiki/api/v2/spaces/" + encode(spaceId) + "/pages?title=" + encode(title)
                + "&status=current&limit=10";
        HttpResponse<String> response = send(request(path).GET().build());
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "search pages titled \"" + title + "\"");
        for (JsonNode result : read(response).path("results")) {
            if (title.equals(result.path("title").asText())) {
                return Optional.of(result.path("id").asText());
            }
        }
        LOGGER.debug("No page titled \"{}\" in space {}", title, spaceId);
        return Optional.empty();
    }

    private ObjectNode storageBody(String content) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("representation", "storage");
        body.put("value", Objects.requireNonNullElse(content, ""));
        return body;
    }

    private HttpRequest.Builder request(String pathAndQuery) {
        return HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .header("Authorization", authorization);
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PageStoreException("Interrupted while calling Confluence", ex);
        } catch (IOException ex) {
            throw new PageStoreException("Failed to invoke Confluence API", ex);
        }
    }

    private void requireSuccess(HttpResponse<String> response, String operation) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new PageStoreException("Failed to " + operation + ": Confluence returned status "
                    + status + ": " + response.body());
        }
    }

    private JsonNode read(HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new PageStoreException("Malformed response from Confluence", ex);
        }
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new PageStoreException("Failed to serialize page payload", ex);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static URI stripTrailingSlash(URI uri) {
        String raw = uri.toString();
        return raw.endsWith("/") ? URI.create(raw.substring(0, raw.length() - 1)) : uri;
    }
}

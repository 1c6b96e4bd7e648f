package io.intellixity.tabula.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.TransientStoreException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.error.VersionConflictException;
import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.Patch;
import io.intellixity.tabula.patch.TabulaJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link ViewSyncClient} over the server's REST API.\n
 *
 * Status mapping: 409 is a version conflict, 404 not found, 400/422 a validation error; other
 * statuses and I/O failures are transient.\n
 */
public final class HttpViewSyncClient implements ViewSyncClient {
  private static final Logger log = LoggerFactory.getLogger(HttpViewSyncClient.class);
  private static final TypeReference<List<ViewRecord>> VIEWS = new TypeReference<>() {};

  public static final String USER_HEADER = "X-User-Id";

  private final String baseUrl;
  private final String userId;
  private final Duration readTimeout;
  private final HttpClient http;
  private final ObjectMapper json;

  public HttpViewSyncClient(String baseUrl, String userId, int connectMs, int readMs) {
    this(baseUrl, userId, Duration.ofMillis(readMs),
        HttpClient.newBuilder().connectTimeout(Duration.ofMillis(connectMs)).build(), TabulaJson.mapper());
  }

  public HttpViewSyncClient(String baseUrl, String userId, Duration readTimeout, HttpClient http, ObjectMapper json) {
    Objects.requireNonNull(baseUrl, "baseUrl");
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.userId = Objects.requireNonNull(userId, "userId");
    this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    this.http = Objects.requireNonNull(http, "http");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public CompletableFuture<AppliedPatches> applyPatches(String viewId, int version, List<Patch> patches) {
    ObjectNode body = json.createObjectNode();
    body.put("version", version);
    body.set("patches", json.valueToTree(patches));
    HttpRequest req = request("/api/views/" + viewId + "/patches")
        .POST(HttpRequest.BodyPublishers.ofString(write(body)))
        .build();
    return exchange(req, "view", viewId, version, node -> new AppliedPatches(
        node.path("id").asText(viewId),
        node.path("version").asInt(),
        read(node.get("config"), ViewConfig.class)));
  }

  @Override
  public CompletableFuture<List<ViewRecord>> listViews(String tableId) {
    HttpRequest req = request("/api/tables/" + tableId + "/views").GET().build();
    return exchange(req, "table", tableId, -1, node -> json.convertValue(node, VIEWS));
  }

  @Override
  public CompletableFuture<ViewRecord> createView(String tableId, String name) {
    ObjectNode body = json.createObjectNode();
    body.put("name", name);
    HttpRequest req = request("/api/tables/" + tableId + "/views")
        .POST(HttpRequest.BodyPublishers.ofString(write(body)))
        .build();
    return exchange(req, "table", tableId, -1, node -> read(node, ViewRecord.class));
  }

  @Override
  public CompletableFuture<Void> deleteView(String viewId) {
    HttpRequest req = request("/api/views/" + viewId).DELETE().build();
    return exchange(req, "view", viewId, -1, node -> null);
  }

  private HttpRequest.Builder request(String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .timeout(readTimeout)
        .header(USER_HEADER, userId)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json");
  }

  private <T> CompletableFuture<T> exchange(HttpRequest req, String kind, String id, int sentVersion,
                                            Function<JsonNode, T> onOk) {
    if (log.isDebugEnabled()) log.debug("tabula.http request method={} uri={}", req.method(), req.uri());
    return http.sendAsync(req, BodyHandlers.ofString())
        .exceptionally(e -> {
          throw new TransientStoreException("Request failed: " + req.method() + " " + req.uri(), ViewSyncCoordinator.unwrap(e));
        })
        .thenApply(resp -> {
          int status = resp.statusCode();
          JsonNode node = parse(resp);
          if (status >= 200 && status < 300) return onOk.apply(node);
          throw toError(status, node, kind, id, sentVersion);
        });
  }

  static RuntimeException toError(int status, JsonNode body, String kind, String id, int sentVersion) {
    String message = body.path("message").asText("HTTP " + status);
    return switch (status) {
      case 409 -> new VersionConflictException(id, sentVersion, body.path("serverVersion").asInt(-1));
      case 404 -> new NotFoundException(kind, id);
      case 400, 422 -> new ValidationException(message);
      default -> new TransientStoreException("HTTP " + status + ": " + message);
    };
  }

  private JsonNode parse(HttpResponse<String> resp) {
    String body = resp.body();
    if (body == null || body.isBlank()) return json.createObjectNode();
    try {
      return json.readTree(body);
    } catch (JsonProcessingException e) {
      if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
        throw new IllegalStateException("Malformed response from " + resp.uri(), e);
      }
      return json.createObjectNode();
    }
  }

  private String write(JsonNode node) {
    try {
      return json.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot encode request body", e);
    }
  }

  private <T> T read(JsonNode node, Class<T> type) {
    try {
      return json.treeToValue(node, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Malformed " + type.getSimpleName() + " in response", e);
    }
  }
}

package io.intellixity.tabula.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sun.net.httpserver.HttpServer;
import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.TransientStoreException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.error.VersionConflictException;
import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.Patch;
import io.intellixity.tabula.patch.PatchPath;
import io.intellixity.tabula.patch.TabulaJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class HttpViewSyncClientTest {
  private HttpServer server;
  private HttpViewSyncClient client;
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastUser = new AtomicReference<>();

  @BeforeEach
  void start() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
    client = new HttpViewSyncClient("http://127.0.0.1:" + server.getAddress().getPort() + "/", "u1", 2_000, 5_000);
  }

  @AfterEach
  void stop() {
    server.stop(0);
  }

  private void route(String path, int status, String body) {
    server.createContext(path, ex -> {
      lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      lastUser.set(ex.getRequestHeaders().getFirst(HttpViewSyncClient.USER_HEADER));
      byte[] out = body.getBytes(StandardCharsets.UTF_8);
      ex.getResponseHeaders().add("Content-Type", "application/json");
      ex.sendResponseHeaders(status, out.length == 0 ? -1 : out.length);
      if (out.length > 0) {
        try (OutputStream os = ex.getResponseBody()) {
          os.write(out);
        }
      }
      ex.close();
    });
  }

  @Test
  void applyPatches_sendsVersionAndParsesCanonicalConfig() throws Exception {
    route("/api/views/v1/patches", 200,
        "{\"success\":true,\"id\":\"v1\",\"version\":3,\"config\":{\"filters\":[],\"sort\":[],\"columns\":[],\"search\":\"q\"}}");

    AppliedPatches out = client.applyPatches("v1", 2,
        List.of(Patch.set(PatchPath.SEARCH, TextNode.valueOf("q"), 5))).join();

    assertEquals(3, out.version());
    assertEquals("q", out.config().search());
    assertEquals("u1", lastUser.get());
    JsonNode sent = TabulaJson.mapper().readTree(lastBody.get());
    assertEquals(2, sent.get("version").asInt());
    assertEquals("search", sent.get("patches").get(0).get("path").asText());
    assertEquals("set", sent.get("patches").get(0).get("op").asText());
  }

  @Test
  void applyPatches_conflictCarriesServerVersion() {
    route("/api/views/v1/patches", 409, "{\"error\":\"version_conflict\",\"message\":\"stale\",\"serverVersion\":7}");

    CompletionException e = assertThrows(CompletionException.class,
        () -> client.applyPatches("v1", 2, List.of()).join());

    VersionConflictException c = assertInstanceOf(VersionConflictException.class, e.getCause());
    assertEquals(2, c.expectedVersion());
    assertEquals(7, c.actualVersion());
  }

  @Test
  void listViews_readsRecords() {
    route("/api/tables/t1/views", 200,
        "[{\"id\":\"v0\",\"tableId\":\"t1\",\"name\":\"Grid view\",\"version\":4,"
            + "\"config\":{\"filters\":[],\"sort\":[],\"columns\":[],\"search\":\"\"},"
            + "\"createdAt\":\"2024-03-01T10:00:00Z\",\"updatedAt\":\"2024-03-01T10:00:00Z\",\"default\":true}]");

    List<ViewRecord> views = client.listViews("t1").join();

    assertEquals(1, views.size());
    assertEquals(4, views.get(0).version());
    assertTrue(views.get(0).isDefault());
  }

  @Test
  void deleteView_validationErrorIsSurfaced() {
    route("/api/views/v0", 400, "{\"error\":\"validation\",\"message\":\"Cannot delete the default view\"}");

    CompletionException e = assertThrows(CompletionException.class, () -> client.deleteView("v0").join());
    assertInstanceOf(ValidationException.class, e.getCause());
    assertEquals("Cannot delete the default view", e.getCause().getMessage());
  }

  @Test
  void toError_mapsStatuses() {
    JsonNode empty = TabulaJson.mapper().createObjectNode();
    assertInstanceOf(NotFoundException.class, HttpViewSyncClient.toError(404, empty, "view", "v1", -1));
    assertInstanceOf(ValidationException.class, HttpViewSyncClient.toError(422, empty, "view", "v1", -1));
    assertInstanceOf(TransientStoreException.class, HttpViewSyncClient.toError(503, empty, "view", "v1", -1));
  }

  @Test
  void unreachableServer_isTransient() {
    server.stop(0);
    CompletionException e = assertThrows(CompletionException.class, () -> client.listViews("t1").join());
    assertInstanceOf(TransientStoreException.class, e.getCause());
  }
}

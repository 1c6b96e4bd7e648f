package io.intellixity.tabula.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * A path-scoped replacement instruction for a view's stored configuration.\n
 *
 * <p>{@code timestamp} is the client clock (millis) at the time the UI produced the change;
 * it only orders patches for coalescing and is never compared with server time.</p>
 */
public record Patch(PatchOp op, PatchPath path, JsonNode value, long timestamp) {
  public Patch {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(path, "path");
    value = (value == null) ? NullNode.getInstance() : value;
  }

  public static Patch set(PatchPath path, JsonNode value, long timestamp) {
    return new Patch(PatchOp.SET, path, value, timestamp);
  }

  public static Patch merge(PatchPath path, JsonNode value, long timestamp) {
    return new Patch(PatchOp.MERGE, path, value, timestamp);
  }

  /** Coalescing identity. */
  public Key key() {
    return new Key(op, path);
  }

  public record Key(PatchOp op, PatchPath path) {}
}

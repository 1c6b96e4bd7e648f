package io.intellixity.tabula.model;

import java.time.Instant;
import java.util.Objects;

/** A table together with its owning user. */
public record TableRef(String id, String ownerId, String name, Instant createdAt) {
  public TableRef {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
  }
}

package io.intellixity.tabula.sync;

import io.intellixity.tabula.model.ViewConfig;

/** Server answer to an accepted patch set: the new version and the canonical configuration. */
public record AppliedPatches(String viewId, int version, ViewConfig config) {}

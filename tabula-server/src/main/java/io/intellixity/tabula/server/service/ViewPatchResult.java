package io.intellixity.tabula.server.service;

import io.intellixity.tabula.model.ViewConfig;
import io.intellixity.tabula.model.ViewRecord;

/** Success payload of a patch apply: the view's new version and the configuration it now stores. */
public record ViewPatchResult(boolean success, String id, int version, ViewConfig config) {
  public static ViewPatchResult of(ViewRecord v) {
    return new ViewPatchResult(true, v.id(), v.version(), v.config());
  }
}

package io.intellixity.tabula.patch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces timestamped patches to at most one per (op, path), keeping the newest.\n
 *
 * Output is ordered by the timestamp of each surviving patch. Equal timestamps resolve to the
 * patch that appears later in the input.\n
 */
public final class PatchCoalescer {
  private PatchCoalescer() {}

  public static List<Patch> coalesce(List<Patch> patches) {
    if (patches == null || patches.isEmpty()) return List.of();

    List<Patch> sorted = new ArrayList<>(patches);
    sorted.sort(Comparator.comparingLong(Patch::timestamp)); // stable

    Map<Patch.Key, Patch> latest = new LinkedHashMap<>();
    for (Patch p : sorted) {
      latest.remove(p.key());
      latest.put(p.key(), p);
    }
    return List.copyOf(latest.values());
  }
}

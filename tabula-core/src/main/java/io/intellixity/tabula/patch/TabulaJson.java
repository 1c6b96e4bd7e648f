package io.intellixity.tabula.patch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.tabula.model.ColumnSetting;
import io.intellixity.tabula.model.FilterGroup;
import io.intellixity.tabula.model.SortSpec;

import java.util.List;

/** Shared Jackson mapper plus typed readers for the patchable view fields. */
public final class TabulaJson {
  private static final ObjectMapper MAPPER = newMapper();

  private static final TypeReference<List<FilterGroup>> FILTERS = new TypeReference<>() {};
  private static final TypeReference<List<SortSpec>> SORT = new TypeReference<>() {};
  private static final TypeReference<List<ColumnSetting>> COLUMNS = new TypeReference<>() {};

  private TabulaJson() {}

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static ObjectMapper newMapper() {
    ObjectMapper m = new ObjectMapper();
    m.registerModule(new JavaTimeModule());
    m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return m;
  }

  public static JsonNode toTree(Object value) {
    return MAPPER.valueToTree(value);
  }

  public static List<FilterGroup> readFilters(JsonNode node) {
    return isAbsent(node) ? List.of() : MAPPER.convertValue(node, FILTERS);
  }

  public static List<SortSpec> readSort(JsonNode node) {
    return isAbsent(node) ? List.of() : MAPPER.convertValue(node, SORT);
  }

  public static List<ColumnSetting> readColumns(JsonNode node) {
    return isAbsent(node) ? List.of() : MAPPER.convertValue(node, COLUMNS);
  }

  public static String readSearch(JsonNode node) {
    return isAbsent(node) ? "" : node.asText("");
  }

  private static boolean isAbsent(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }
}

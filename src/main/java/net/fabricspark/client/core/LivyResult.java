package net.fabricspark.client.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import net.fabricspark.client.jdbc.LivyColumnMetadata;

/** Rows and schema of one finished statement, rows in server order. */
public class LivyResult {
  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getObjectMapper();

  static final LivyResult EMPTY =
      new LivyResult(Collections.<List<Object>>emptyList(), Collections.emptyList());

  private final List<List<Object>> rows;
  private final List<LivyColumnMetadata> schema;

  public LivyResult(List<List<Object>> rows, List<LivyColumnMetadata> schema) {
    this.rows = Collections.unmodifiableList(rows);
    this.schema = Collections.unmodifiableList(schema);
  }

  /**
   * Reads the <code>application/json</code> payload of a statement output, <code>
   * {"data": [[...], ...], "schema": {"fields": [...]}}</code>. A missing payload gives an empty
   * result.
   *
   * @param payload the payload node, possibly missing
   * @return the result
   */
  static LivyResult fromPayload(JsonNode payload) {
    if (payload == null || payload.isMissingNode() || payload.isNull()) {
      return EMPTY;
    }
    List<List<Object>> rows = new ArrayList<>();
    for (JsonNode row : payload.path("data")) {
      rows.add(toRow(row));
    }
    List<LivyColumnMetadata> schema = new ArrayList<>();
    for (JsonNode field : payload.path("schema").path("fields")) {
      schema.add(LivyColumnMetadata.fromJson(field));
    }
    return new LivyResult(rows, schema);
  }

  private static List<Object> toRow(JsonNode row) {
    List<Object> values = new ArrayList<>();
    if (row.isArray()) {
      for (JsonNode value : row) {
        values.add(toValue(value));
      }
    } else if (row.isObject()) {
      for (Iterator<JsonNode> it = row.elements(); it.hasNext(); ) {
        values.add(toValue(it.next()));
      }
    } else {
      values.add(toValue(row));
    }
    return values;
  }

  private static Object toValue(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    return OBJECT_MAPPER.convertValue(value, Object.class);
  }

  public List<List<Object>> getRows() {
    return rows;
  }

  public List<LivyColumnMetadata> getSchema() {
    return schema;
  }
}

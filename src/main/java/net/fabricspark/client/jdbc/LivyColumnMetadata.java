package net.fabricspark.client.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.Serializable;
import java.util.Objects;

/** One field of the schema Spark returns with a statement result. */
public class LivyColumnMetadata implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String name;
  private final String typeName;
  private final boolean nullable;

  public LivyColumnMetadata(String name, String typeName, boolean nullable) {
    this.name = name;
    this.typeName = typeName;
    this.nullable = nullable;
  }

  /**
   * Builds the metadata from a Spark schema field, e.g. <code>
   * {"name":"a","type":"integer","nullable":true,"metadata":{}}</code>. Complex types come as an
   * object whose own <code>type</code> names them (struct, array, map).
   *
   * @param field JSON field node
   * @return column metadata
   */
  public static LivyColumnMetadata fromJson(JsonNode field) {
    JsonNode type = field.path("type");
    String typeName = type.isObject() ? type.path("type").asText(null) : type.asText(null);
    // Spark marks every column nullable unless told otherwise
    boolean nullable = field.path("nullable").asBoolean(true);
    return new LivyColumnMetadata(field.path("name").asText(null), typeName, nullable);
  }

  public String getName() {
    return name;
  }

  public String getTypeName() {
    return typeName;
  }

  public boolean isNullable() {
    return nullable;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LivyColumnMetadata)) {
      return false;
    }
    LivyColumnMetadata that = (LivyColumnMetadata) o;
    return nullable == that.nullable
        && Objects.equals(name, that.name)
        && Objects.equals(typeName, that.typeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeName, nullable);
  }

  @Override
  public String toString() {
    return "LivyColumnMetadata{name="
        + name
        + ", type="
        + typeName
        + ", nullable="
        + nullable
        + "}";
  }
}

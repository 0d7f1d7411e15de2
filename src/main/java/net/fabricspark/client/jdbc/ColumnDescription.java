package net.fabricspark.client.jdbc;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Description of a result column in the usual cursor layout: name, type, display size, internal
 * size, precision, scale and nullability. Only name, type and nullability are known.
 */
public class ColumnDescription {
  private final String name;
  private final String typeName;
  private final boolean nullable;

  public ColumnDescription(String name, String typeName, boolean nullable) {
    this.name = name;
    this.typeName = typeName;
    this.nullable = nullable;
  }

  static ColumnDescription of(LivyColumnMetadata metadata) {
    return new ColumnDescription(
        metadata.getName(), metadata.getTypeName(), metadata.isNullable());
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

  /** @return (name, type, null, null, null, null, nullable) */
  public List<Object> asTuple() {
    return Arrays.<Object>asList(name, typeName, null, null, null, null, nullable);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ColumnDescription that = (ColumnDescription) o;
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
    return asTuple().toString();
  }
}

package net.fabricspark.client.shortcut;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One entry of the shortcuts file: a OneLake shortcut to create in the target lakehouse. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ShortcutDefinition {
  private final String path;
  private final String shortcutName;
  private final String sourcePath;
  private final String sourceWorkspaceId;
  private final String sourceItemId;

  @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
  public ShortcutDefinition(
      @JsonProperty(value = "path", required = true) String path,
      @JsonProperty(value = "shortcut_name", required = true) String shortcutName,
      @JsonProperty(value = "source_path", required = true) String sourcePath,
      @JsonProperty(value = "source_workspace_id", required = true) String sourceWorkspaceId,
      @JsonProperty(value = "source_item_id", required = true) String sourceItemId) {
    this.path = path;
    this.shortcutName = shortcutName;
    this.sourcePath = sourcePath;
    this.sourceWorkspaceId = sourceWorkspaceId;
    this.sourceItemId = sourceItemId;
  }

  public String getPath() {
    return path;
  }

  public String getShortcutName() {
    return shortcutName;
  }

  public String getSourcePath() {
    return sourcePath;
  }

  public String getSourceWorkspaceId() {
    return sourceWorkspaceId;
  }

  public String getSourceItemId() {
    return sourceItemId;
  }

  /** @return the body of a create shortcut request */
  Map<String, Object> toRequestBody() {
    Map<String, Object> oneLake = new LinkedHashMap<>();
    oneLake.put("workspaceId", sourceWorkspaceId);
    oneLake.put("itemId", sourceItemId);
    oneLake.put("path", sourcePath);
    Map<String, Object> target = new LinkedHashMap<>();
    target.put("oneLake", oneLake);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("path", path);
    body.put("name", shortcutName);
    body.put("target", target);
    return body;
  }

  /**
   * @param existing shortcut as returned by the Fabric API
   * @return true if the existing shortcut points at the same OneLake source
   */
  boolean hasSameTarget(JsonNode existing) {
    JsonNode oneLake = existing.path("target").path("oneLake");
    return Objects.equals(sourceWorkspaceId, oneLake.path("workspaceId").asText(null))
        && Objects.equals(sourceItemId, oneLake.path("itemId").asText(null))
        && Objects.equals(sourcePath, oneLake.path("path").asText(null));
  }

  @Override
  public String toString() {
    return path + "/" + shortcutName + " -> " + sourceWorkspaceId + "/" + sourceItemId + "/"
        + sourcePath;
  }
}

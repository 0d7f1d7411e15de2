package net.fabricspark.client.shortcut;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import net.fabricspark.client.core.HttpStatusException;
import net.fabricspark.client.core.HttpUtil;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.core.LivySessionProperty;
import net.fabricspark.client.core.ObjectMapperFactory;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;

/**
 * Creates OneLake shortcuts in a lakehouse through the Fabric REST API. Existing shortcuts with
 * the same target are left alone, shortcuts pointing elsewhere are replaced.
 */
public class ShortcutClient {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(ShortcutClient.class);

  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getObjectMapper();

  public static final String FABRIC_API_URL = "https://api.fabric.microsoft.com/v1";

  private final String accessToken;
  private final String workspaceId;
  private final String lakehouseId;
  private final CloseableHttpClient httpClient;
  private final String apiUrl;

  public ShortcutClient(
      String accessToken,
      String workspaceId,
      String lakehouseId,
      CloseableHttpClient httpClient) {
    this(accessToken, workspaceId, lakehouseId, httpClient, FABRIC_API_URL);
  }

  ShortcutClient(
      String accessToken,
      String workspaceId,
      String lakehouseId,
      CloseableHttpClient httpClient,
      String apiUrl) {
    this.accessToken = accessToken;
    this.workspaceId = workspaceId;
    this.lakehouseId = lakehouseId;
    this.httpClient = httpClient;
    this.apiUrl = apiUrl;
  }

  /**
   * Creates every shortcut listed in the given file.
   *
   * @param shortcutsJsonPath path of a JSON array of shortcut definitions
   * @throws LivyException if the file can not be read or a Fabric API call fails
   */
  public void createShortcuts(String shortcutsJsonPath) throws LivyException {
    List<ShortcutDefinition> shortcuts = readShortcuts(shortcutsJsonPath);
    logger.debug("Provisioning {} shortcuts from {}", shortcuts.size(), shortcutsJsonPath);
    for (ShortcutDefinition shortcut : shortcuts) {
      createShortcut(shortcut);
    }
  }

  static List<ShortcutDefinition> readShortcuts(String shortcutsJsonPath) throws LivyException {
    try (InputStream in = Files.newInputStream(Paths.get(shortcutsJsonPath))) {
      String json = IOUtils.toString(in, StandardCharsets.UTF_8);
      return OBJECT_MAPPER.readValue(json, new TypeReference<List<ShortcutDefinition>>() {});
    } catch (IOException ex) {
      throw new LivyException(
          ex,
          ErrorCode.INVALID_CONNECTION_PROPERTY,
          LivySessionProperty.SHORTCUTS_JSON_PATH.getPropertyKey(),
          ex.getMessage());
    }
  }

  void createShortcut(ShortcutDefinition shortcut) throws LivyException {
    JsonNode existing = getShortcut(shortcut);
    if (existing != null) {
      if (shortcut.hasSameTarget(existing)) {
        logger.info("Shortcut {} already exists", shortcut.getShortcutName());
        return;
      }
      logger.info(
          "Shortcut {} exists with a different target, recreating", shortcut.getShortcutName());
      HttpDelete delete = new HttpDelete(shortcutUrl(shortcut));
      execute(delete);
    }
    HttpPost post = new HttpPost(shortcutsUrl());
    try {
      post.setEntity(
          new StringEntity(
              OBJECT_MAPPER.writeValueAsString(shortcut.toRequestBody()),
              ContentType.APPLICATION_JSON));
    } catch (JsonProcessingException ex) {
      throw new LivyException(ex, ErrorCode.INTERNAL_ERROR, "unable to serialize shortcut");
    }
    execute(post);
    logger.info("Shortcut {} created", shortcut);
  }

  /** @return the shortcut, or null if it does not exist */
  JsonNode getShortcut(ShortcutDefinition shortcut) throws LivyException {
    String body;
    try {
      body = execute(new HttpGet(shortcutUrl(shortcut)));
    } catch (HttpStatusException ex) {
      if (ex.getStatusCode() == HttpStatus.SC_NOT_FOUND) {
        return null;
      }
      throw ex;
    }
    try {
      return OBJECT_MAPPER.readTree(body);
    } catch (IOException ex) {
      throw new LivyException(ex, ErrorCode.BAD_RESPONSE, "unable to decode shortcut " + shortcut);
    }
  }

  private String execute(HttpRequestBase request) throws LivyException {
    request.setHeader("Authorization", "Bearer " + accessToken);
    request.setHeader("Content-Type", "application/json");
    return HttpUtil.executeRequest(request, httpClient);
  }

  String shortcutsUrl() {
    return apiUrl + "/workspaces/" + workspaceId + "/items/" + lakehouseId + "/shortcuts";
  }

  String shortcutUrl(ShortcutDefinition shortcut) {
    return shortcutsUrl() + "/" + shortcut.getPath() + "/" + shortcut.getShortcutName();
  }
}

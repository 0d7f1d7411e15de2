package net.fabricspark.client.config;

import static net.fabricspark.client.jdbc.LivyUtil.isNullOrEmpty;
import static net.fabricspark.client.jdbc.LivyUtil.systemGetEnv;
import static net.fabricspark.client.jdbc.LivyUtil.systemGetProperty;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;
import java.util.Properties;
import net.fabricspark.client.core.LivyCredentials;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.core.ObjectMapperFactory;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;
import org.apache.commons.io.IOUtils;

/**
 * Reads connection profiles from a JSON file of the form <code>
 * {"default": {"workspaceId": "...", "lakehouseId": "...", ...}, "dev": {...}}</code>. Profile
 * entries use the keys of {@link net.fabricspark.client.core.LivySessionProperty}.
 */
public class LivyConnectionConfigParser {
  private static final LivyLogger logger =
      LivyLoggerFactory.getLogger(LivyConnectionConfigParser.class);

  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getObjectMapper();

  public static final String CONNECTION_FILE_ENV_NAME = "FABRIC_SPARK_CONNECTION_FILE";
  public static final String CONNECTION_DIRECTORY_NAME = ".fabricspark";
  public static final String CONNECTION_FILE_NAME = "connections.json";
  public static final String DEFAULT_PROFILE = "default";

  /**
   * Builds credentials from a profile of the connection file. The file is searched in this
   * order: 1. the configFilePath param. 2. the file named by the FABRIC_SPARK_CONNECTION_FILE
   * environment variable. 3. connections.json under ~/.fabricspark.
   *
   * @param configFilePath explicit file path, may be null
   * @param profile profile name, null for the default profile
   * @return credentials built from the profile
   * @throws LivyException if no file is found, it can not be read, the profile is missing, or the
   *     profile does not make valid credentials
   */
  public static LivyCredentials buildCredentials(String configFilePath, String profile)
      throws LivyException {
    return LivyCredentials.fromProperties(loadProfile(configFilePath, profile));
  }

  /**
   * @param configFilePath explicit file path, may be null
   * @param profile profile name, null for the default profile
   * @return the profile entries as connection properties
   * @throws LivyException if no file is found, it can not be read, or the profile is missing
   */
  public static Properties loadProfile(String configFilePath, String profile)
      throws LivyException {
    String profileName = isNullOrEmpty(profile) ? DEFAULT_PROFILE : profile;
    Path path = resolveConfigFilePath(configFilePath);
    if (path == null) {
      throw new LivyException(
          ErrorCode.MISSING_CONNECTION_PROPERTY,
          "no connection file found, set " + CONNECTION_FILE_ENV_NAME);
    }
    JsonNode root = readFile(path);
    JsonNode entries = root.get(profileName);
    if (entries == null || !entries.isObject()) {
      throw new LivyException(
          ErrorCode.MISSING_CONNECTION_PROPERTY,
          "profile " + profileName + " in " + path);
    }
    logger.debug("Using profile {} from {}", profileName, path);

    Properties properties = new Properties();
    for (Iterator<Map.Entry<String, JsonNode>> it = entries.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode value = entry.getValue();
      if (value.isNull()) {
        continue;
      }
      if (value.isValueNode()) {
        properties.put(entry.getKey(), value.asText());
      } else {
        properties.put(entry.getKey(), OBJECT_MAPPER.convertValue(value, Object.class));
      }
    }
    return properties;
  }

  /** @return the connection file to read, or null if none exists */
  static Path resolveConfigFilePath(String configFilePath) {
    if (!isNullOrEmpty(configFilePath)) {
      logger.info("Using connection file specified by caller: {}", configFilePath);
      return Paths.get(configFilePath);
    }
    String fromEnv = systemGetEnv(CONNECTION_FILE_ENV_NAME);
    if (!isNullOrEmpty(fromEnv)) {
      logger.info("Using connection file specified from environment variable: {}", fromEnv);
      return Paths.get(fromEnv);
    }
    String homeDirectory = systemGetProperty("user.home");
    if (homeDirectory != null) {
      Path inHome = Paths.get(homeDirectory, CONNECTION_DIRECTORY_NAME, CONNECTION_FILE_NAME);
      if (Files.exists(inHome)) {
        logger.info("Using connection file from home directory: {}", inHome);
        return inHome;
      }
    }
    return null;
  }

  private static JsonNode readFile(Path path) throws LivyException {
    try (InputStream in = Files.newInputStream(path)) {
      JsonNode root = OBJECT_MAPPER.readTree(IOUtils.toString(in, StandardCharsets.UTF_8));
      if (root == null || !root.isObject()) {
        throw new LivyException(
            ErrorCode.INVALID_CONNECTION_PROPERTY, path.toString(), "not a JSON object");
      }
      return root;
    } catch (IOException ex) {
      throw new LivyException(
          ex, ErrorCode.INVALID_CONNECTION_PROPERTY, path.toString(), ex.getMessage());
    }
  }
}

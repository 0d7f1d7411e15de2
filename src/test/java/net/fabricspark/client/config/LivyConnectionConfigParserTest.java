package net.fabricspark.client.config;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import net.fabricspark.client.core.LivyCredentials;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.jdbc.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LivyConnectionConfigParserTest {
  private static final String CONNECTIONS =
      "{\n"
          + "  \"default\": {\n"
          + "    \"workspaceId\": \"ws-1\",\n"
          + "    \"lakehouseId\": \"lh-1\",\n"
          + "    \"authentication\": \"cli\",\n"
          + "    \"livySessionName\": \"dbt\",\n"
          + "    \"keepSession\": true,\n"
          + "    \"sessionPollWait\": 10,\n"
          + "    \"livySessionParameters\": {\"spark.executor.cores\": \"4\"},\n"
          + "    \"executeRetryPatterns\": [\"403 Forbidden\", \"throttled\"]\n"
          + "  },\n"
          + "  \"prod\": {\n"
          + "    \"workspaceId\": \"ws-2\",\n"
          + "    \"lakehouseId\": \"lh-2\",\n"
          + "    \"authentication\": \"spn\",\n"
          + "    \"tenantId\": \"tenant\",\n"
          + "    \"clientId\": \"client\",\n"
          + "    \"clientSecret\": \"secret\",\n"
          + "    \"shortcutsJsonPath\": null\n"
          + "  }\n"
          + "}\n";

  @TempDir Path tempDir;

  private Path configFile;

  @BeforeEach
  public void setUp() throws Exception {
    configFile = tempDir.resolve("connections.json");
    Files.write(configFile, CONNECTIONS.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testDefaultProfile() throws Exception {
    LivyCredentials credentials =
        LivyConnectionConfigParser.buildCredentials(configFile.toString(), null);

    assertThat(credentials.getWorkspaceId(), equalTo("ws-1"));
    assertThat(credentials.getLivySessionName(), equalTo("dbt"));
    assertTrue(credentials.isKeepSession());
    assertTrue(credentials.isCliAuthentication());
    assertThat(credentials.getSessionPollWait(), equalTo(Duration.ofSeconds(10)));
    assertThat(
        credentials.getLivySessionParameters(),
        equalTo(Collections.<String, Object>singletonMap("spark.executor.cores", "4")));
    assertThat(
        credentials.getExecuteRetryPatterns(),
        equalTo(Arrays.asList("403 Forbidden", "throttled")));
  }

  @Test
  public void testNamedProfile() throws Exception {
    LivyCredentials credentials =
        LivyConnectionConfigParser.buildCredentials(configFile.toString(), "prod");

    assertThat(credentials.getWorkspaceId(), equalTo("ws-2"));
    assertThat(credentials.getClientSecret(), equalTo("secret"));
    assertThat(credentials.getShortcutsJsonPath(), equalTo(null));
  }

  @Test
  public void testMissingProfile() {
    LivyException ex =
        assertThrows(
            LivyException.class,
            () -> LivyConnectionConfigParser.loadProfile(configFile.toString(), "dev"));
    assertEquals(ErrorCode.MISSING_CONNECTION_PROPERTY, ex.getErrorCode());
  }

  @Test
  public void testUnreadableFile() throws Exception {
    Path broken = tempDir.resolve("broken.json");
    Files.write(broken, "{not json".getBytes(StandardCharsets.UTF_8));

    LivyException ex =
        assertThrows(
            LivyException.class,
            () -> LivyConnectionConfigParser.loadProfile(broken.toString(), null));
    assertEquals(ErrorCode.INVALID_CONNECTION_PROPERTY, ex.getErrorCode());

    ex =
        assertThrows(
            LivyException.class,
            () ->
                LivyConnectionConfigParser.loadProfile(
                    tempDir.resolve("absent.json").toString(), null));
    assertEquals(ErrorCode.INVALID_CONNECTION_PROPERTY, ex.getErrorCode());
  }

  @Test
  public void testExplicitPathWins() {
    assertThat(
        LivyConnectionConfigParser.resolveConfigFilePath(configFile.toString()),
        equalTo(configFile));
  }
}

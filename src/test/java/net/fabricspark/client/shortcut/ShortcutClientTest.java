package net.fabricspark.client.shortcut;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.jdbc.ErrorCode;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.ProtocolVersion;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicStatusLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

public class ShortcutClientTest {
  private static final String API = "https://fabric.test/v1";
  private static final String SHORTCUT_URL =
      API + "/workspaces/ws-1/items/lh-1/shortcuts/Tables/sales";

  private static final String SHORTCUTS =
      "[{\"path\": \"Tables\", \"shortcut_name\": \"sales\", \"source_path\": \"Tables/sales\","
          + " \"source_workspace_id\": \"ws-src\", \"source_item_id\": \"lh-src\"}]";

  @TempDir Path tempDir;

  private CloseableHttpClient httpClient;
  private ShortcutClient client;
  private String shortcutsFile;

  @BeforeEach
  public void setUp() throws Exception {
    httpClient = mock(CloseableHttpClient.class);
    client = new ShortcutClient("token", "ws-1", "lh-1", httpClient, API);
    Path file = tempDir.resolve("shortcuts.json");
    Files.write(file, SHORTCUTS.getBytes(StandardCharsets.UTF_8));
    shortcutsFile = file.toString();
  }

  private static CloseableHttpResponse response(int statusCode, String body) {
    CloseableHttpResponse response = mock(CloseableHttpResponse.class);
    when(response.getStatusLine())
        .thenReturn(new BasicStatusLine(new ProtocolVersion("HTTP", 1, 1), statusCode, "reason"));
    when(response.getEntity()).thenReturn(new StringEntity(body, StandardCharsets.UTF_8));
    return response;
  }

  private static String existing(String workspaceId, String itemId, String path) {
    return "{\"path\": \"Tables\", \"name\": \"sales\", \"target\": {\"oneLake\": {"
        + "\"workspaceId\": \""
        + workspaceId
        + "\", \"itemId\": \""
        + itemId
        + "\", \"path\": \""
        + path
        + "\"}}}";
  }

  private List<HttpUriRequest> sentRequests(int count) throws Exception {
    ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(httpClient, times(count)).execute(captor.capture());
    return captor.getAllValues();
  }

  @Test
  public void testMissingShortcutIsCreated() throws Exception {
    CloseableHttpResponse notFound = response(404, "{\"errorCode\": \"EntityNotFound\"}");
    CloseableHttpResponse created = response(201, "{}");
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(notFound, created);

    client.createShortcuts(shortcutsFile);

    List<HttpUriRequest> sent = sentRequests(2);
    assertThat(sent.get(0).getMethod(), equalTo("GET"));
    assertThat(sent.get(0).getURI().toString(), equalTo(SHORTCUT_URL));
    assertThat(sent.get(0).getFirstHeader("Authorization").getValue(), equalTo("Bearer token"));
    assertThat(sent.get(1).getMethod(), equalTo("POST"));
    assertThat(
        sent.get(1).getURI().toString(), equalTo(API + "/workspaces/ws-1/items/lh-1/shortcuts"));
    String body =
        IOUtils.toString(
            ((HttpEntityEnclosingRequest) sent.get(1)).getEntity().getContent(),
            StandardCharsets.UTF_8);
    assertThat(
        body,
        equalTo(
            "{\"path\":\"Tables\",\"name\":\"sales\",\"target\":{\"oneLake\":"
                + "{\"workspaceId\":\"ws-src\",\"itemId\":\"lh-src\","
                + "\"path\":\"Tables/sales\"}}}"));
  }

  @Test
  public void testMatchingShortcutIsKept() throws Exception {
    CloseableHttpResponse found = response(200, existing("ws-src", "lh-src", "Tables/sales"));
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(found);

    client.createShortcuts(shortcutsFile);

    assertThat(sentRequests(1).get(0).getMethod(), equalTo("GET"));
  }

  @Test
  public void testMismatchingShortcutIsRecreated() throws Exception {
    CloseableHttpResponse found = response(200, existing("ws-src", "lh-other", "Tables/sales"));
    CloseableHttpResponse deleted = response(200, "");
    CloseableHttpResponse created = response(201, "{}");
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(found, deleted, created);

    client.createShortcuts(shortcutsFile);

    List<HttpUriRequest> sent = sentRequests(3);
    assertThat(sent.get(1).getMethod(), equalTo("DELETE"));
    assertThat(sent.get(1).getURI().toString(), equalTo(SHORTCUT_URL));
    assertThat(sent.get(2).getMethod(), equalTo("POST"));
  }

  @Test
  public void testServerErrorIsRaised() throws Exception {
    CloseableHttpResponse error = response(500, "oops");
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(error);

    LivyException ex =
        assertThrows(LivyException.class, () -> client.createShortcuts(shortcutsFile));
    assertEquals(ErrorCode.NETWORK_ERROR, ex.getErrorCode());
  }

  @Test
  public void testUnreadableShortcutsFile() {
    LivyException ex =
        assertThrows(
            LivyException.class,
            () -> client.createShortcuts(tempDir.resolve("absent.json").toString()));
    assertEquals(ErrorCode.INVALID_CONNECTION_PROPERTY, ex.getErrorCode());
  }
}

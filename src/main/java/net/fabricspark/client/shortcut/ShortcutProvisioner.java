package net.fabricspark.client.shortcut;

import java.io.IOException;
import net.fabricspark.client.core.HttpUtil;
import net.fabricspark.client.core.LivyCredentials;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.jdbc.ErrorCode;
import org.apache.http.impl.client.CloseableHttpClient;

/** Sets up the shortcuts a new session relies on. */
@FunctionalInterface
public interface ShortcutProvisioner {
  ShortcutProvisioner FABRIC_API =
      (accessToken, workspaceId, lakehouseId, shortcutsJsonPath) -> {
        try (CloseableHttpClient httpClient =
            HttpUtil.buildHttpClient(
                LivyCredentials.DEFAULT_CONNECT_TIMEOUT, LivyCredentials.DEFAULT_SOCKET_TIMEOUT)) {
          new ShortcutClient(accessToken, workspaceId, lakehouseId, httpClient)
              .createShortcuts(shortcutsJsonPath);
        } catch (IOException ex) {
          throw new LivyException(
              ex, ErrorCode.NETWORK_ERROR, ShortcutClient.FABRIC_API_URL, ex.getMessage());
        }
      };

  void provision(
      String accessToken, String workspaceId, String lakehouseId, String shortcutsJsonPath)
      throws LivyException;
}

package net.fabricspark.client.core;

import static net.fabricspark.client.core.LivyTestUtil.LAKEHOUSE_ID;
import static net.fabricspark.client.core.LivyTestUtil.WORKSPACE_ID;
import static net.fabricspark.client.core.LivyTestUtil.credentials;
import static net.fabricspark.client.core.LivyTestUtil.credentialsBuilder;
import static net.fabricspark.client.core.LivyTestUtil.json;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.azure.core.credential.AccessToken;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.jdbc.LivyConnection;
import net.fabricspark.client.jdbc.LivyCursor;
import net.fabricspark.client.shortcut.ShortcutProvisioner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

public class LivySessionManagerTest {
  private LivySession session;
  private LivyRestClient restClient;
  private AccessTokenCache tokenCache;
  private ShortcutProvisioner provisioner;
  private AtomicInteger sessionsBuilt;
  private LivySessionManager manager;

  @BeforeEach
  public void setUp() throws Exception {
    session = mock(LivySession.class);
    restClient = mock(LivyRestClient.class);
    tokenCache = mock(AccessTokenCache.class);
    provisioner = mock(ShortcutProvisioner.class);
    sessionsBuilt = new AtomicInteger();
    when(session.getSessionId()).thenReturn("42");
    when(session.getRestClient()).thenReturn(restClient);
    when(session.getOrCreate()).thenReturn("42");
    when(tokenCache.getAccessToken(any()))
        .thenReturn(new AccessToken("token", OffsetDateTime.now().plusHours(1)));
    manager =
        new LivySessionManager(
            credentials -> {
              sessionsBuilt.incrementAndGet();
              return session;
            },
            tokenCache,
            provisioner,
            duration -> {},
            Clock.systemUTC());
  }

  @Test
  public void testFirstConnectAdoptsOrCreatesSession() throws Exception {
    LivyConnection connection = manager.connect(credentials());

    assertThat(connection.getSessionId(), equalTo("42"));
    assertThat(manager.getSession(), sameInstance(session));
    InOrder inOrder = inOrder(session);
    inOrder.verify(session).getOrCreate();
    inOrder.verify(session).setNewSessionRequired(false);
    verify(session, never()).create();
    verify(provisioner, never()).provision(anyString(), anyString(), anyString(), anyString());
  }

  @Test
  public void testFirstConnectProvisionsShortcuts() throws Exception {
    manager.connect(credentialsBuilder().setShortcutsJsonPath("/tmp/shortcuts.json").build());

    verify(provisioner).provision("token", WORKSPACE_ID, LAKEHOUSE_ID, "/tmp/shortcuts.json");
  }

  @Test
  public void testShortcutFailureDoesNotFailConnect() throws Exception {
    doThrow(new LivyException(ErrorCode.NETWORK_ERROR, "POST", "refused"))
        .when(provisioner)
        .provision(anyString(), anyString(), anyString(), anyString());

    LivyConnection connection =
        manager.connect(credentialsBuilder().setShortcutsJsonPath("/tmp/shortcuts.json").build());

    assertThat(connection.getSessionId(), equalTo("42"));
  }

  @Test
  public void testFailedFirstConnectLeavesNoSession() throws Exception {
    when(session.getOrCreate())
        .thenThrow(new LivyException(ErrorCode.CONNECTION_ERROR, "session is dead"));

    LivyException ex = assertThrows(LivyException.class, () -> manager.connect(credentials()));

    assertEquals(ErrorCode.CONNECTION_ERROR, ex.getErrorCode());
    assertNull(manager.getSession());
  }

  @Test
  public void testStatementsOfConnectionsSharingSessionRunOneAtATime() throws Exception {
    when(session.isValid()).thenReturn(true);
    when(session.statementsPath()).thenReturn("/sessions/42/statements");
    when(session.statementPath(anyString())).thenReturn("/sessions/42/statements/0");
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    when(restClient.post(anyString(), any()))
        .thenAnswer(
            invocation -> {
              int running = inFlight.incrementAndGet();
              maxInFlight.accumulateAndGet(running, Math::max);
              Thread.sleep(50);
              return json("{'id': 0, 'state': 'waiting'}");
            });
    when(restClient.get("/sessions/42/statements/0"))
        .thenAnswer(
            invocation -> {
              inFlight.decrementAndGet();
              return json("{'state': 'available', 'output': {'status': 'ok'}}");
            });

    List<LivyConnection> connections = new ArrayList<>();
    connections.add(manager.connect(credentials()));
    connections.add(manager.connect(credentials()));

    ExecutorService pool = Executors.newFixedThreadPool(connections.size());
    try {
      List<Future<Void>> results = new ArrayList<>();
      for (LivyConnection connection : connections) {
        LivyCursor cursor = connection.cursor();
        Callable<Void> statement =
            () -> {
              cursor.execute("select 1", StatementKind.SQL);
              return null;
            };
        results.add(pool.submit(statement));
      }
      for (Future<Void> result : results) {
        result.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(maxInFlight.get(), equalTo(1));
    verify(restClient, times(2)).post(anyString(), any());
  }

  @Test
  public void testReusesValidSession() throws Exception {
    LivyCredentials credentials = credentials();
    manager.connect(credentials);
    when(session.isValid()).thenReturn(true);
    when(session.isNewSessionRequired()).thenReturn(false);

    manager.connect(credentials);

    assertThat(sessionsBuilt.get(), equalTo(1));
    verify(session, times(1)).getOrCreate();
    verify(session, never()).create();
    verify(session, never()).delete();
  }

  @Test
  public void testInvalidSessionIsReplaced() throws Exception {
    LivyCredentials credentials = credentials();
    manager.connect(credentials);
    when(session.isValid()).thenReturn(false);

    manager.connect(credentials);

    InOrder inOrder = inOrder(session);
    inOrder.verify(session).delete();
    inOrder.verify(session).create();
    inOrder.verify(session).setNewSessionRequired(false);
  }

  @Test
  public void testDisconnectThenConnectCreatesFreshSession() throws Exception {
    LivyCredentials credentials = credentials();
    manager.connect(credentials);
    when(session.isValid()).thenReturn(true);
    when(session.isKeepingSession()).thenReturn(false);

    manager.disconnect();

    verify(session).delete();
    verify(session).setNewSessionRequired(true);

    when(session.isNewSessionRequired()).thenReturn(true);
    manager.connect(credentials);

    verify(session).create();
  }

  @Test
  public void testKeepSessionIsNeverDeleted() throws Exception {
    manager.connect(credentialsBuilder().setKeepSession(true).build());
    when(session.isValid()).thenReturn(true);
    when(session.isKeepingSession()).thenReturn(true);

    manager.disconnect();
    manager.close();

    verify(session, never()).delete();
    verify(restClient).close();
  }

  @Test
  public void testDisconnectSkipsInvalidSession() throws Exception {
    manager.connect(credentials());
    when(session.isValid()).thenReturn(false);

    manager.disconnect();

    verify(session, never()).delete();
  }

  @Test
  public void testDisconnectWithoutSessionIsNoop() {
    manager.disconnect();
    assertNull(manager.getSession());
  }

  @Test
  public void testCloseDisconnectsAndReleasesHttpClient() throws Exception {
    manager.connect(credentials());
    when(session.isValid()).thenReturn(true);

    manager.close();

    verify(session).delete();
    verify(restClient).close();
  }
}

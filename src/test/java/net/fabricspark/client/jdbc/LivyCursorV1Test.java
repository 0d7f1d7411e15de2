package net.fabricspark.client.jdbc;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.core.LivyResult;
import net.fabricspark.client.core.LivyStatementExecutor;
import net.fabricspark.client.core.StatementKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LivyCursorV1Test {
  private LivyStatementExecutor executor;
  private LivyCursorV1 cursor;

  @BeforeEach
  public void setUp() {
    executor = mock(LivyStatementExecutor.class);
    cursor = new LivyCursorV1(executor);
  }

  private static LivyResult twoRows() {
    List<List<Object>> rows = new ArrayList<>();
    rows.add(Arrays.<Object>asList(1, "x"));
    rows.add(Arrays.<Object>asList(2, "y"));
    return new LivyResult(
        rows,
        Arrays.asList(
            new LivyColumnMetadata("a", "int", true),
            new LivyColumnMetadata("b", "string", false)));
  }

  @Test
  public void testFetchOneInOrderThenNull() throws Exception {
    when(executor.execute(anyString(), any())).thenReturn(twoRows());

    cursor.execute("select a, b from t", StatementKind.SQL);

    assertThat(cursor.fetchOne(), equalTo(Arrays.<Object>asList(1, "x")));
    assertThat(cursor.fetchOne(), equalTo(Arrays.<Object>asList(2, "y")));
    assertNull(cursor.fetchOne());
    assertTrue(cursor.fetchAll().isEmpty());
  }

  @Test
  public void testFetchAll() throws Exception {
    assertNull(cursor.fetchAll());
    when(executor.execute(anyString(), any())).thenReturn(twoRows());

    cursor.execute("select a, b from t", StatementKind.SQL);

    assertEquals(2, cursor.fetchAll().size());
    assertEquals(2, cursor.fetchAll().size());
  }

  @Test
  public void testDescription() throws Exception {
    assertTrue(cursor.getDescription().isEmpty());
    when(executor.execute(anyString(), any())).thenReturn(twoRows());

    cursor.execute("select a, b from t", StatementKind.SQL);

    List<ColumnDescription> description = cursor.getDescription();
    assertThat(
        description.get(0).asTuple(),
        equalTo(Arrays.<Object>asList("a", "int", null, null, null, null, true)));
    assertThat(description.get(1).asTuple().get(6), equalTo((Object) false));
  }

  @Test
  public void testSqlBlockCommentsAreStripped() throws Exception {
    when(executor.execute(anyString(), any())).thenReturn(twoRows());

    cursor.execute("  /* model: x */\nselect 1 /* inline */ from t  ", StatementKind.SQL);

    verify(executor).execute("select 1\nfrom t", StatementKind.SQL);
  }

  @Test
  public void testPysparkIsDedented() throws Exception {
    when(executor.execute(anyString(), any())).thenReturn(twoRows());

    cursor.execute("    df = spark.sql('x')\n      \n    df.show()", StatementKind.PYSPARK);

    verify(executor).execute("df = spark.sql('x')\n\ndf.show()", StatementKind.PYSPARK);
  }

  @Test
  public void testParametersAreInterpolated() throws Exception {
    when(executor.execute(anyString(), any())).thenReturn(twoRows());

    cursor.execute("select * from t where a = %s and b like 'x%%'", StatementKind.SQL, 1.0);

    verify(executor).execute("select * from t where a = 1.0 and b like 'x%'", StatementKind.SQL);
  }

  @Test
  public void testParameterCountMismatch() {
    LivySQLException ex =
        assertThrows(
            LivySQLException.class,
            () -> cursor.execute("select %s, %s", StatementKind.SQL, "'a'"));
    assertEquals(ErrorCode.INVALID_PARAMETER_BINDING, ex.getLivyErrorCode());
  }

  @Test
  public void testFailureClearsResult() throws Exception {
    when(executor.execute(anyString(), any()))
        .thenReturn(twoRows())
        .thenThrow(new LivyException(ErrorCode.QUERY_EXECUTION_ERROR, "boom"));
    cursor.execute("select 1", StatementKind.SQL);

    LivySQLException ex =
        assertThrows(
            LivySQLException.class, () -> cursor.execute("select 2", StatementKind.SQL));

    assertEquals(ErrorCode.QUERY_EXECUTION_ERROR, ex.getLivyErrorCode());
    assertEquals(200012, ex.getErrorCode());
    assertEquals(ErrorCode.QUERY_EXECUTION_ERROR.getSqlState(), ex.getSQLState());
    assertThat(ex.getMessage(), equalTo("Error while executing query: boom"));
    assertNull(cursor.fetchAll());
    assertTrue(cursor.getDescription().isEmpty());
  }

  @Test
  public void testCloseIsIdempotent() throws Exception {
    when(executor.execute(anyString(), any()))
        .thenReturn(
            new LivyResult(Collections.<List<Object>>emptyList(), Collections.emptyList()));
    cursor.execute("select 1", StatementKind.SQL);

    cursor.close();
    cursor.close();

    assertNull(cursor.fetchAll());
    assertNull(cursor.fetchOne());
  }
}

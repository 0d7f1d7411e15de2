package net.fabricspark.client.jdbc;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class LivyUtilTest {

  @Test
  public void testStripBlockComments() {
    assertThat(LivyUtil.stripBlockComments("select 1"), equalTo("select 1"));
    assertThat(
        LivyUtil.stripBlockComments("/* a */ select 1 /* multi\nline */ , 2 /* c */"),
        equalTo("select 1\n, 2"));
    assertThat(
        LivyUtil.stripBlockComments("  select '--x' -- kept\n"), equalTo("select '--x' -- kept"));
  }

  @Test
  public void testDedent() {
    assertThat(LivyUtil.dedent("  a\n    b\n  c"), equalTo("a\n  b\nc"));
    assertThat(LivyUtil.dedent("a\n  b"), equalTo("a\n  b"));
    assertThat(LivyUtil.dedent("\tx\n\ty\n"), equalTo("x\ny\n"));
    assertThat(LivyUtil.dedent("  x\n \t \n  y"), equalTo("x\n\ny"));
  }

  @Test
  public void testInterpolate() throws Exception {
    assertThat(LivyUtil.interpolate("a = %s, b = %s", 1.0, "'x'"), equalTo("a = 1.0, b = 'x'"));
    assertThat(LivyUtil.interpolate("100%% of %s", "''"), equalTo("100% of ''"));
    assertThat(LivyUtil.interpolate("no placeholders"), equalTo("no placeholders"));
  }

  @Test
  public void testInterpolateMismatch() {
    LivySQLException tooFew =
        assertThrows(LivySQLException.class, () -> LivyUtil.interpolate("%s %s", "a"));
    assertEquals(ErrorCode.INVALID_PARAMETER_BINDING, tooFew.getLivyErrorCode());

    LivySQLException tooMany =
        assertThrows(LivySQLException.class, () -> LivyUtil.interpolate("%s", "a", "b"));
    assertEquals(ErrorCode.INVALID_PARAMETER_BINDING, tooMany.getLivyErrorCode());
  }

  @Test
  public void testIsNullOrEmpty() {
    assertTrue(LivyUtil.isNullOrEmpty(null));
    assertTrue(LivyUtil.isNullOrEmpty(""));
    assertFalse(LivyUtil.isNullOrEmpty(" "));
  }
}

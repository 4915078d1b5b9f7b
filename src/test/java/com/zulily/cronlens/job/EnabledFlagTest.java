package com.zulily.cronlens.job;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EnabledFlagTest {

  @Test
  public void testBooleans() {
    assertTrue(EnabledFlag.normalize(Boolean.TRUE));
    assertFalse(EnabledFlag.normalize(Boolean.FALSE));
  }

  @Test
  public void testText() {
    assertTrue(EnabledFlag.normalize("true"));
    assertTrue(EnabledFlag.normalize("TRUE"));
    assertTrue(EnabledFlag.normalize(" True "));
    assertFalse(EnabledFlag.normalize("false"));
    assertFalse(EnabledFlag.normalize("yes"));
    assertFalse(EnabledFlag.normalize(""));
  }

  @Test
  public void testAnythingElseIsDisabled() {
    assertFalse(EnabledFlag.normalize(null));
    assertFalse(EnabledFlag.normalize(1));
  }
}

package exm.yang.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.yang.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    System.clearProperty(Settings.TAB_WIDTH);
    for (String key: Settings.getKeys()) {
      Settings.reset(key);
    }
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(8, Settings.getTabWidth());
    assertEquals("<input>", Settings.get(Settings.INPUT_NAME));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testSystemOverride() throws InvalidOptionException {
    System.setProperty(Settings.TAB_WIDTH, "4");
    Settings.initProperties();
    assertEquals(4, Settings.getTabWidth());
  }

  @Test
  public void testBadTabWidth() throws InvalidOptionException {
    Settings.set(Settings.TAB_WIDTH, "0");
    exception.expect(InvalidOptionException.class);
    Settings.getTabWidth();
  }

  @Test
  public void testMaxDepth() throws InvalidOptionException {
    assertEquals(1000, Settings.getMaxDepth());
    Settings.set(Settings.MAX_DEPTH, "-3");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("yang.parser.max-depth must be a positive");
    Settings.getMaxDepth();
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "maybe");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("must be true or false");
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test
  public void testResetRestoresDefault() throws InvalidOptionException {
    Settings.set(Settings.TAB_WIDTH, "2");
    assertEquals(2, Settings.getTabWidth());
    Settings.reset(Settings.TAB_WIDTH);
    assertEquals(8, Settings.getTabWidth());
  }

  @Test
  public void testSetupLogging() throws InvalidOptionException {
    Logger logger = Logging.setupLogging("", false);
    assertEquals(Level.INFO, logger.getLevel());
    logger = Logging.setupLogging("SettingsTest.yang.log", true);
    assertEquals(Level.TRACE, logger.getLevel());
    assertEquals(Logging.getYangLogger(), logger);
  }

  @Test
  public void testSetupLoggingFromSettings() throws InvalidOptionException {
    Settings.set(Settings.LOG_FILE, "SettingsTest.yang.log");
    Settings.set(Settings.LOG_TRACE, "false");
    assertEquals(Level.DEBUG, Logging.setupLogging().getLevel());
  }
}

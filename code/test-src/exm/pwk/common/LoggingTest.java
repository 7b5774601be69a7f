package exm.pwk.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.pwk.common.exceptions.InvalidOptionException;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void reset() {
    Settings.unset(Settings.LOG_FILE);
    Settings.unset(Settings.LOG_TRACE);
    Logging.setupLogging("", false);
  }

  private static String read(File f) throws IOException {
    return new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
  }

  @Test
  public void testConsoleOnly() {
    Logger logger = Logging.setupLogging("", false);
    assertEquals(Level.WARN, logger.getLevel());
    assertFalse(logger.isDebugEnabled());
  }

  @Test
  public void testFileLogging() throws IOException {
    File log = tmp.newFile("debug.log");
    Logger logger = Logging.setupLogging(log.getPath(), false);
    assertTrue(logger.isDebugEnabled());
    assertFalse(logger.isTraceEnabled());
    logger.debug("hello from the test");
    assertTrue(read(log).contains("hello from the test"));
  }

  @Test
  public void testFromSettings() throws IOException, InvalidOptionException {
    File log = tmp.newFile("trace.log");
    Settings.set(Settings.LOG_FILE, log.getPath());
    Settings.set(Settings.LOG_TRACE, "true");
    Logger logger = Logging.setupLoggingFromSettings();
    assertTrue(logger.isTraceEnabled());

    NodeGraph g = new NodeGraph();
    g.build(OpCode.LOAD, g.var(OpCode.VAR_X));
    assertTrue("Node allocation traced", read(log).contains("New node"));
  }

  @Test
  public void testUniqueWarn() throws IOException {
    File log = tmp.newFile("warn.log");
    Logging.setupLogging(log.getPath(), false);
    String msg = "unique warning " + System.nanoTime();
    Logging.uniqueWarn(msg);
    Logging.uniqueWarn(msg);
    int warnings = 0;
    for (String line: read(log).split("\n")) {
      if (line.startsWith("WARN") && line.endsWith(msg)) {
        warnings++;
      }
    }
    assertEquals(1, warnings);
    assertTrue(read(log).contains("Duplicate Warning: " + msg));
  }
}

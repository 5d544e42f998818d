package io.envlog.sdk.logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.envlog.sdk.core.DirectiveParser;
import io.envlog.sdk.core.LevelResolver;
import io.envlog.sdk.types.Level;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class EnvLogLoggerTest {
  private static final String LOGGER_NAME = "envlog.test.logger";

  private Logger backendLogger;
  private ch.qos.logback.classic.Level originalLevel;
  private boolean originalAdditive;
  private ListAppender<ILoggingEvent> appender;
  private LevelResolver resolver;

  @BeforeEach
  void setUp() {
    backendLogger = (Logger) LoggerFactory.getLogger(LOGGER_NAME);
    originalLevel = backendLogger.getLevel();
    originalAdditive = backendLogger.isAdditive();
    backendLogger.setLevel(ch.qos.logback.classic.Level.TRACE);
    backendLogger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    backendLogger.addAppender(appender);

    resolver = new LevelResolver(DirectiveParser.parse("warn,envlog.test=debug"));
  }

  @AfterEach
  void tearDown() {
    backendLogger.detachAppender(appender);
    backendLogger.setAdditive(originalAdditive);
    backendLogger.setLevel(originalLevel);
    appender.stop();
    MDC.clear();
  }

  private List<String> messages() {
    return appender.list.stream()
        .map(ILoggingEvent::getFormattedMessage)
        .collect(Collectors.toList());
  }

  @Test
  void gatesCallsOnResolvedLevel() {
    EnvLogLogger logger = EnvLogLogger.getLogger(LOGGER_NAME, resolver);

    logger.trace("trace {}", 1);
    logger.debug("debug {}", 2);
    logger.info("info");
    logger.warn("warn", new IllegalStateException("boom"));
    logger.error("error {} {}", "a", "b");

    assertEquals(List.of("debug 2", "info", "warn", "error a b"), messages());
    assertEquals("boom", appender.list.get(2).getThrowableProxy().getMessage());
  }

  @Test
  void followsReconfiguration() {
    EnvLogLogger logger = EnvLogLogger.getLogger(LOGGER_NAME, resolver);
    assertFalse(logger.isTraceEnabled());

    resolver.reconfigure("warn,envlog.test.logger=trace");

    assertTrue(logger.isTraceEnabled());
    assertEquals(Level.TRACE, logger.getEffectiveLevel());
  }

  @Test
  void backendLevelStillApplies() {
    backendLogger.setLevel(ch.qos.logback.classic.Level.ERROR);
    EnvLogLogger logger = EnvLogLogger.getLogger(LOGGER_NAME, resolver);

    logger.info("suppressed by backend");

    assertFalse(logger.isInfoEnabled());
    assertTrue(messages().isEmpty());
  }

  @Test
  void neverLogsAtOff() {
    resolver.reconfigure("off");
    EnvLogLogger logger = EnvLogLogger.getLogger(LOGGER_NAME, resolver);

    assertFalse(logger.isEnabled(Level.OFF));
    assertFalse(logger.isErrorEnabled());
    logger.logWithContext(Level.OFF, "nothing", Map.of());
    logger.error("nothing either");
    assertTrue(messages().isEmpty());
  }

  @Test
  void logWithContextScopesMdcEntries() {
    EnvLogLogger logger = EnvLogLogger.getLogger(LOGGER_NAME, resolver);
    MDC.put("request", "outer");

    logger.logWithContext(Level.INFO, "handled", Map.of("request", "42", "user", "alice"));

    assertEquals(List.of("handled"), messages());
    Map<String, String> mdc = appender.list.get(0).getMDCPropertyMap();
    assertEquals("42", mdc.get("request"));
    assertEquals("alice", mdc.get("user"));
    assertEquals("outer", MDC.get("request"));
    assertNull(MDC.get("user"));
  }

  @Test
  void sharedLoggersAreCachedByName() {
    assertSame(EnvLogLogger.getLogger(LOGGER_NAME), EnvLogLogger.getLogger(LOGGER_NAME));
    assertEquals(LOGGER_NAME, EnvLogLogger.getLogger(LOGGER_NAME).getName());
    assertThrows(NullPointerException.class, () -> EnvLogLogger.getLogger((String) null));
  }
}

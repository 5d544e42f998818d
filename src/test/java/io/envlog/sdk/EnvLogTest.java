package io.envlog.sdk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.envlog.sdk.config.EnvLogConfigImpl;
import io.envlog.sdk.constants.EnvLogConstants;
import io.envlog.sdk.core.Ruleset;
import io.envlog.sdk.logger.LoggerBackend;
import io.envlog.sdk.logger.logback.EnvLogTurboFilter;
import io.envlog.sdk.runtime.EnvLogRuntime;
import io.envlog.sdk.types.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class EnvLogTest {
  @AfterEach
  void tearDown() {
    EnvLog.shutdown();
    EnvLog.getResolver().replace(Ruleset.defaults());
    System.clearProperty(EnvLogConstants.SYSTEM_PROPERTY_DIRECTIVES);
  }

  private static boolean turboFilterInstalled() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    return context.getTurboFilterList().stream().anyMatch(f -> f instanceof EnvLogTurboFilter);
  }

  @Test
  void initInstallsLogbackFilterUntilShutdown() {
    EnvLog.init(EnvLogConfigImpl.builder().directives("warn,envlog.demo=debug").build());

    assertTrue(EnvLog.isInitialized());
    assertEquals(LoggerBackend.LOGBACK, EnvLogRuntime.getInstance().getInstalledBackend());
    assertTrue(turboFilterInstalled());
    assertEquals(Level.DEBUG, EnvLog.effectiveLevel("envlog.demo.service"));
    assertTrue(LoggerFactory.getLogger("envlog.demo.service").isDebugEnabled());
    assertFalse(LoggerFactory.getLogger("envlog.other").isInfoEnabled());

    EnvLog.shutdown();

    assertFalse(EnvLog.isInitialized());
    assertFalse(turboFilterInstalled());
  }

  @Test
  void initReadsSystemPropertyWhenVariableIsUnset() {
    System.setProperty(EnvLogConstants.SYSTEM_PROPERTY_DIRECTIVES, "error,envlog.prop=trace");

    EnvLog.init(
        EnvLogConfigImpl.builder()
            .envVariable("ENVLOG_TEST_UNSET_VARIABLE")
            .installBackendFilter(false)
            .build());

    assertEquals(Level.TRACE, EnvLog.effectiveLevel("envlog.prop.x"));
    assertEquals(Level.ERROR, EnvLog.effectiveLevel("x"));
    assertEquals(LoggerBackend.NONE, EnvLogRuntime.getInstance().getInstalledBackend());
    assertFalse(turboFilterInstalled());
  }

  @Test
  void configuredFallbackAppliesWithoutBareLevel() {
    EnvLog.init(
        EnvLogConfigImpl.builder()
            .directives("myapp=info")
            .fallbackLevel(Level.ERROR)
            .installBackendFilter(false)
            .build());

    assertEquals(Level.ERROR, EnvLog.effectiveLevel("somelib"));
    assertEquals(Level.ERROR, EnvLog.reconfigure("myapp=debug").getDefaultLevel());
  }

  @Test
  void reconfigureIsIdempotent() {
    EnvLog.init(EnvLogConfigImpl.builder().directives("info").installBackendFilter(false).build());

    Ruleset once = EnvLog.reconfigure("warn,myapp=debug");
    Ruleset twice = EnvLog.reconfigure("warn,myapp=debug");

    assertEquals(once, twice);
    assertSame(twice, EnvLog.getResolver().getRuleset());
    assertTrue(EnvLog.isEnabled("myapp.api", Level.DEBUG));
    assertFalse(EnvLog.isEnabled("somelib", Level.INFO));
  }

  @Test
  void secondInitKeepsFirstConfiguration() {
    EnvLog.init(EnvLogConfigImpl.builder().directives("info").installBackendFilter(false).build());
    EnvLog.init(EnvLogConfigImpl.builder().directives("trace").installBackendFilter(false).build());

    assertEquals("info", EnvLog.getConfig().getDirectives());
    assertEquals(Level.INFO, EnvLog.effectiveLevel("anything"));
  }

  @Test
  void configureWorksWithoutInit() {
    Ruleset ruleset = EnvLog.configure("debug,myapp=error");

    assertFalse(EnvLog.isInitialized());
    assertEquals(Level.DEBUG, ruleset.getDefaultLevel());
    assertTrue(EnvLog.isEnabled("other", Level.DEBUG));
    assertFalse(EnvLog.isEnabled("myapp", Level.WARN));
    assertThrows(IllegalStateException.class, EnvLog::getConfig);
  }

  @Test
  void skippedDirectivesAreLogged() {
    Logger runtimeLogger = (Logger) LoggerFactory.getLogger(EnvLogRuntime.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    runtimeLogger.addAppender(appender);

    try {
      EnvLog.init(
          EnvLogConfigImpl.builder()
              .directives("warn,bogus=notalevel,myapp=info")
              .installBackendFilter(false)
              .build());
    } finally {
      runtimeLogger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(Level.INFO, EnvLog.effectiveLevel("myapp"));
    assertEquals(Level.WARN, EnvLog.effectiveLevel("bogus"));
    assertTrue(
        appender.list.stream()
            .anyMatch(event -> event.getFormattedMessage().contains("bogus=notalevel")));
  }

  @Test
  void skipReportingCanBeDisabled() {
    Logger runtimeLogger = (Logger) LoggerFactory.getLogger(EnvLogRuntime.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    runtimeLogger.addAppender(appender);

    try {
      EnvLog.init(
          EnvLogConfigImpl.builder()
              .directives("warn,bogus=notalevel")
              .reportSkippedDirectives(false)
              .installBackendFilter(false)
              .build());
    } finally {
      runtimeLogger.detachAppender(appender);
      appender.stop();
    }

    assertTrue(
        appender.list.stream()
            .noneMatch(event -> event.getFormattedMessage().contains("bogus=notalevel")));
  }

  @Test
  void verboseModeLogsLifecycleAtInfo() {
    Logger runtimeLogger = (Logger) LoggerFactory.getLogger(EnvLogRuntime.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    runtimeLogger.addAppender(appender);
    runtimeLogger.setLevel(ch.qos.logback.classic.Level.INFO);

    try {
      EnvLog.init(
          EnvLogConfigImpl.builder()
              .directives("warn,io.envlog.sdk.runtime=info")
              .verbose(true)
              .build());
    } finally {
      runtimeLogger.detachAppender(appender);
      runtimeLogger.setLevel(null);
      appender.stop();
    }

    assertTrue(
        appender.list.stream()
            .anyMatch(
                event ->
                    event.getLevel() == ch.qos.logback.classic.Level.INFO
                        && event.getFormattedMessage().contains("Applied log directives")));
    assertTrue(
        appender.list.stream()
            .anyMatch(
                event ->
                    event.getLevel() == ch.qos.logback.classic.Level.INFO
                        && event.getFormattedMessage().contains("Installed Logback turbo filter")));
  }

  @Test
  void quietModeLogsReconfigureAtDebug() {
    EnvLog.init(EnvLogConfigImpl.builder().directives("info").installBackendFilter(false).build());
    Logger runtimeLogger = (Logger) LoggerFactory.getLogger(EnvLogRuntime.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    runtimeLogger.addAppender(appender);
    runtimeLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);

    try {
      EnvLog.reconfigure("warn,myapp=debug");
    } finally {
      runtimeLogger.detachAppender(appender);
      runtimeLogger.setLevel(null);
      appender.stop();
    }

    assertTrue(
        appender.list.stream()
            .anyMatch(
                event ->
                    event.getLevel() == ch.qos.logback.classic.Level.DEBUG
                        && event.getFormattedMessage().contains("Applied log directives")));
    assertTrue(
        appender.list.stream()
            .noneMatch(event -> event.getLevel() == ch.qos.logback.classic.Level.INFO));
  }

  @Test
  void staleRuntimeShutdownLeavesNewerRuntimeRunning() {
    EnvLog.init(EnvLogConfigImpl.builder().directives("info").installBackendFilter(false).build());
    EnvLogRuntime first = EnvLogRuntime.getInstance();
    EnvLog.shutdown();
    assertNull(EnvLogRuntime.currentInstance());

    EnvLog.init(EnvLogConfigImpl.builder().directives("trace").installBackendFilter(false).build());
    first.shutdown();

    assertTrue(EnvLog.isInitialized());
    assertEquals(Level.TRACE, EnvLog.effectiveLevel("anything"));

    EnvLog.shutdown();
    EnvLog.shutdown();
    assertFalse(EnvLog.isInitialized());
  }
}

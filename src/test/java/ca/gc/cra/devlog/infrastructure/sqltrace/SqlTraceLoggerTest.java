package ca.gc.cra.devlog.infrastructure.sqltrace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.devlog.application.StructuredLogger;
import ca.gc.cra.devlog.application.port.ClockPort;
import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogRecord;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.infrastructure.caller.StackWalkerCallerResolver;
import ca.gc.cra.devlog.testutil.CapturingHandler;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SqlTraceLoggerTest {
  private final CapturingHandler sink = new CapturingHandler();
  private final StructuredLogger logger = new StructuredLogger(sink);

  @Test
  void attributesStatementToCallingMethod() {
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of());

    testDatabaseQuery(trace);

    Source source = sink.lastContext().source().orElseThrow();
    assertTrue(source.file().contains("SqlTraceLoggerTest.java"), source.file());
    assertEquals("testDatabaseQuery", source.function());
    assertTrue(source.line() > 0);
  }

  @Test
  void nestedCallsStillAttributeToQueryMethod() {
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of());

    helperFunction(trace);

    assertEquals("testDatabaseQuery", sink.lastContext().source().orElseThrow().function());
  }

  @Test
  void failedStatementIsLoggedAsError() {
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of(Attr.string("db", "main")));

    trace.trace(LogContext.empty(), Instant.now(), () -> new SqlTrace("SELECT * FROM invalid_table", 0),
        new SQLTimeoutException("deadline exceeded"));

    LogRecord record = sink.lastRecord();
    assertEquals(Level.ERROR, record.level());
    assertEquals("deadline exceeded", record.message());
    assertTrue(record.attrs().isEmpty());
    assertEquals("failedStatementIsLoggedAsError", sink.lastContext().source().orElseThrow().function());
  }

  @Test
  void contextCarriesStatementDetails() {
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of(Attr.string("db", "main")));
    Instant begin = Instant.now().minusMillis(100);

    trace.trace(LogContext.empty().withValue("requestId", "r-1"), begin,
        () -> new SqlTrace("SELECT * FROM users WHERE id = ?", 5), null);

    LogContext context = sink.lastContext();
    assertEquals("SELECT * FROM users WHERE id = ?", context.sql().orElseThrow());
    assertEquals(5L, context.rows().getAsLong());
    assertTrue(context.duration().orElseThrow().compareTo(Duration.ofMillis(100)) >= 0);
    assertEquals("r-1", context.value("requestId").orElseThrow());

    LogRecord record = sink.lastRecord();
    assertEquals(Level.INFO, record.level());
    assertEquals("", record.message());
    assertEquals(List.of(Attr.string("db", "main")), record.attrs());
  }

  @Test
  void elapsedTimeComesFromClock() {
    Instant begin = Instant.parse("2024-03-01T12:00:00Z");
    ClockPort clock = () -> begin.plusMillis(250);
    SqlTraceLogger trace = new SqlTraceLogger(logger, TraceLevel.INFO, false, List.of(),
        new StackWalkerCallerResolver(), clock);

    trace.trace(null, begin, () -> new SqlTrace("UPDATE t SET x = 1", 2), null);

    assertEquals(Duration.ofMillis(250), sink.lastContext().duration().orElseThrow());
  }

  @Test
  void silentSkipsSupplier() {
    AtomicInteger calls = new AtomicInteger();
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of()).logMode(TraceLevel.SILENT);

    trace.trace(LogContext.empty(), Instant.now(), () -> {
      calls.incrementAndGet();
      return new SqlTrace("SELECT 1", 1);
    }, new SQLTimeoutException("late"));

    assertEquals(0, calls.get());
    assertTrue(sink.records.isEmpty());
  }

  @Test
  void errorLevelOnlyTracesFailures() {
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of()).logMode(TraceLevel.ERROR);

    trace.trace(LogContext.empty(), Instant.now(), () -> new SqlTrace("SELECT 1", 1), null);
    assertTrue(sink.records.isEmpty());

    trace.trace(LogContext.empty(), Instant.now(), () -> new SqlTrace("SELECT 1", 0),
        new SQLTimeoutException("late"));
    assertEquals(1, sink.records.size());
  }

  @Test
  void messagesAreGatedByLevel() {
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of()).logMode(TraceLevel.WARN);

    trace.info(LogContext.empty(), "connected");
    trace.warn(LogContext.empty(), "slow pool", "waiters", 3);
    trace.error(LogContext.empty(), "lost connection");

    assertEquals(List.of("slow pool", "lost connection"), sink.records.stream().map(LogRecord::message).toList());
    assertEquals(List.of(Attr.int64("waiters", 3)), sink.records.get(0).attrs());
  }

  @Test
  void logModeReturnsCopy() {
    SqlTraceLogger trace = new SqlTraceLogger(logger, true, List.of());

    SqlTraceLogger quiet = trace.logMode(TraceLevel.SILENT);

    assertNotSame(trace, quiet);
    assertEquals(TraceLevel.INFO, trace.level());
    assertEquals(TraceLevel.SILENT, quiet.level());
    assertTrue(quiet.showParams());
  }

  @Test
  void paramsAreHiddenUnlessShown() {
    SqlStatement statement =
        new SqlStatement("SELECT * FROM users WHERE id = ?", Arrays.<Object>asList(42, null));

    assertSame(statement, new SqlTraceLogger(logger, true, List.of()).paramsFilter(statement));
    SqlStatement hidden = new SqlTraceLogger(logger, false, List.of()).paramsFilter(statement);
    assertEquals(statement.sql(), hidden.sql());
    assertTrue(hidden.params().isEmpty());
  }

  @Test
  void traceLevelsOrderVerbosity() {
    assertFalse(TraceLevel.SILENT.allows(Level.ERROR));
    assertTrue(TraceLevel.ERROR.allows(Level.ERROR));
    assertFalse(TraceLevel.ERROR.allows(Level.WARN));
    assertTrue(TraceLevel.WARN.allows(Level.WARN));
    assertTrue(TraceLevel.INFO.allows(Level.INFO));
    assertFalse(TraceLevel.INFO.allows(Level.DEBUG));
  }

  private static void testDatabaseQuery(SqlTraceLogger trace) {
    Instant begin = Instant.now();
    trace.trace(LogContext.empty(), begin, () -> new SqlTrace("SELECT * FROM users WHERE id = ?", 1), null);
  }

  private static void helperFunction(SqlTraceLogger trace) {
    testDatabaseQuery(trace);
  }
}

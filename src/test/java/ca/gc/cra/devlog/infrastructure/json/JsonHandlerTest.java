package ca.gc.cra.devlog.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.devlog.application.port.RecordHandler;
import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogRecord;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.domain.TextMarshalException;
import ca.gc.cra.devlog.domain.TextMarshaler;
import ca.gc.cra.devlog.infrastructure.buffer.BufferPool;
import ca.gc.cra.devlog.testutil.JsonLines;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonHandlerTest {
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final JsonHandler handler =
      new JsonHandler(out, Level.INFO, ZoneOffset.UTC, new BufferPool(64, 4096, 2));

  @Test
  void writesOneObjectPerLine() throws IOException {
    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "first"));
    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.WARN, "second", Attr.string("k", "v")));

    String text = out.toString(StandardCharsets.UTF_8);
    assertTrue(text.endsWith("}\n"));
    List<Map<String, Object>> lines = JsonLines.parse(text);
    assertEquals(2, lines.size());
    assertEquals("2024-03-01T12:00:00Z", lines.get(0).get("time"));
    assertEquals("INFO", lines.get(0).get("level"));
    assertEquals("first", lines.get(0).get("msg"));
    assertEquals("v", lines.get(1).get("k"));
  }

  @Test
  void zeroTimeIsOmitted() throws IOException {
    handler.handle(LogContext.empty(), LogRecord.of(null, Level.INFO, "m"));

    assertFalse(single().containsKey("time"));
  }

  @Test
  void mapsValueKinds() throws IOException {
    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m",
        Attr.int64("i", -3),
        Attr.uint64("u", -1L),
        Attr.float64("f", 1.5),
        Attr.float64("nan", Double.NaN),
        Attr.bool("b", true),
        Attr.duration("d", Duration.ofMillis(2)),
        Attr.time("t", NOW),
        Attr.error("err", new IllegalStateException("boom")),
        Attr.any("src", new Source("run", "app/Main.java", 12)),
        Attr.any("lvl", Level.WARN),
        Attr.any("nil", null),
        Attr.any("list", List.of(1, 2))));

    Map<String, Object> line = single();
    assertEquals(-3L, ((Number) line.get("i")).longValue());
    assertEquals(new BigInteger("18446744073709551615"), line.get("u"));
    assertEquals(1.5, ((Number) line.get("f")).doubleValue());
    assertEquals("NaN", line.get("nan"));
    assertEquals(Boolean.TRUE, line.get("b"));
    assertEquals(2_000_000L, ((Number) line.get("d")).longValue());
    assertEquals("2024-03-01T12:00:00Z", line.get("t"));
    assertEquals("boom", line.get("err"));
    assertEquals(Map.of("function", "run", "file", "app/Main.java", "line", 12), line.get("src"));
    assertEquals("WARN", line.get("lvl"));
    assertEquals("[1, 2]", line.get("list"));
    assertTrue(line.containsKey("nil"));
    assertNull(line.get("nil"));
  }

  @Test
  void textMarshalerUsesItsText() throws IOException {
    TextMarshaler ok = () -> "ok-text";
    TextMarshaler failing = () -> {
      throw new TextMarshalException("no text");
    };

    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m",
        Attr.any("ok", ok), Attr.any("bad", failing)));

    Map<String, Object> line = single();
    assertEquals("ok-text", line.get("ok"));
    assertEquals("!ERROR:no text", line.get("bad"));
  }

  @Test
  void failingToStringIsReported() throws IOException {
    Object broken = new Object() {
      @Override
      public String toString() {
        throw new IllegalStateException("kaput");
      }
    };

    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m", Attr.any("x", broken)));

    assertEquals("!PANIC: kaput", single().get("x"));
  }

  @Test
  void runtimeFailureInMarshalTextStaysInItsValue() throws IOException {
    String missing = null;
    TextMarshaler nullDeref = () -> missing.trim();
    TextMarshaler exploding = () -> {
      throw new IllegalStateException("boom");
    };

    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m",
        Attr.any("bad", nullDeref), Attr.any("worse", exploding), Attr.string("after", "ok")));

    Map<String, Object> line = single();
    assertEquals("<nil>", line.get("bad"));
    assertEquals("!PANIC: boom", line.get("worse"));
    assertEquals("ok", line.get("after"));
  }

  @Test
  void failureWithoutMessageReportsItsType() throws IOException {
    Object broken = new Object() {
      @Override
      public String toString() {
        throw new UnsupportedOperationException();
      }
    };

    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m", Attr.any("x", broken)));

    assertEquals("!PANIC: java.lang.UnsupportedOperationException", single().get("x"));
  }

  @Test
  void nestsGroupsAndBoundAttributes() throws IOException {
    RecordHandler derived = handler
        .withAttrs(List.of(Attr.string("app", "orders")))
        .withGroup("req")
        .withAttrs(List.of(Attr.string("id", "r-1")))
        .withGroup("db");

    derived.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m", Attr.int64("rows", 3)));

    Map<String, Object> line = single();
    assertEquals("orders", line.get("app"));
    @SuppressWarnings("unchecked")
    Map<String, Object> req = (Map<String, Object>) line.get("req");
    assertEquals("r-1", req.get("id"));
    assertEquals(Map.of("rows", 3), req.get("db"));
  }

  @Test
  void emptyGroupsAreOmitted() throws IOException {
    RecordHandler derived = handler.withGroup("req").withGroup("db");

    derived.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m",
        Attr.group("g"), Attr.group("outer", Attr.group("inner"))));

    Map<String, Object> line = single();
    assertFalse(line.containsKey("req"));
    assertFalse(line.containsKey("g"));
    assertFalse(line.containsKey("outer"));
  }

  @Test
  void inlineGroupMembersAreFlattened() throws IOException {
    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m",
        Attr.group("", Attr.int64("a", 1), Attr.int64("b", 2))));

    Map<String, Object> line = single();
    assertEquals(1, ((Number) line.get("a")).intValue());
    assertEquals(2, ((Number) line.get("b")).intValue());
  }

  @Test
  void derivationDoesNotAffectParent() throws IOException {
    handler.withAttrs(List.of(Attr.string("child", "yes"))).withGroup("g");

    handler.handle(LogContext.empty(), LogRecord.of(NOW, Level.INFO, "m"));

    Map<String, Object> line = single();
    assertFalse(line.containsKey("child"));
    assertFalse(line.containsKey("g"));
  }

  @Test
  void emptyDerivationReturnsSameHandler() {
    assertSame(handler, handler.withAttrs(List.of()));
    assertSame(handler, handler.withGroup(null));
  }

  @Test
  void enabledHonorsFloor() {
    assertFalse(handler.enabled(Level.DEBUG));
    assertTrue(handler.enabled(Level.INFO));
  }

  private Map<String, Object> single() {
    List<Map<String, Object>> lines = JsonLines.parse(out.toString(StandardCharsets.UTF_8));
    assertEquals(1, lines.size());
    return lines.get(0);
  }
}

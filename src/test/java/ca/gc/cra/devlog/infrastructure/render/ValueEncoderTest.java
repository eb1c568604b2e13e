package ca.gc.cra.devlog.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogValuer;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.domain.TextMarshalException;
import ca.gc.cra.devlog.domain.TextMarshaler;
import ca.gc.cra.devlog.domain.Value;
import ca.gc.cra.devlog.infrastructure.buffer.GrowableBuffer;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class ValueEncoderTest {
  private final ValueEncoder plain = new ValueEncoder(AnsiPalette.NONE, ZoneId.of("UTC"));
  private final ValueEncoder colored = new ValueEncoder(AnsiPalette.ANSI, ZoneId.of("UTC"));

  @Test
  void scalarKindsRenderInCanonicalForm() {
    assertEquals("s=text ", render(plain, Attr.string("s", "text")));
    assertEquals("n=-7 ", render(plain, Attr.int64("n", -7)));
    assertEquals("u=18446744073709551615 ", render(plain, Attr.uint64("u", -1L)));
    assertEquals("f=1.5 ", render(plain, Attr.float64("f", 1.5)));
    assertEquals("b=true ", render(plain, Attr.bool("b", true)));
    assertEquals("d=250ms ", render(plain, Attr.duration("d", Duration.ofMillis(250))));
    assertEquals("t=\"2024-03-01 12:00:00 +0000 UTC\" ",
        render(plain, Attr.time("t", Instant.parse("2024-03-01T12:00:00Z"))));
  }

  @Test
  void stringsNeedingQuotesAreQuoted() {
    assertEquals("msg=\"hello world\" ", render(plain, Attr.string("msg", "hello world")));
    assertEquals("empty=\"\" ", render(plain, Attr.string("empty", "")));
  }

  @Test
  void keysAreRenderedFaintAndNeverQuoted() {
    assertEquals(AnsiPalette.FAINT_CODE + "my key=" + AnsiPalette.RESET_CODE + "v ",
        render(colored, Attr.string("my key", "v")));
  }

  @Test
  void zeroAttributeIsSkipped() {
    assertEquals("", render(plain, Attr.EMPTY));
  }

  @Test
  void groupsFlattenIntoDottedKeys() {
    Attr group = Attr.group("req", Attr.string("method", "GET"), Attr.group("user", Attr.int64("id", 7)));
    assertEquals("req.method=GET req.user.id=7 ", render(plain, group));
  }

  @Test
  void emptyGroupRendersNothingAndUnnamedGroupInlines() {
    assertEquals("", render(plain, Attr.group("empty")));
    assertEquals("a=1 b=2 ", render(plain, Attr.group("", Attr.int64("a", 1), Attr.int64("b", 2))));
  }

  @Test
  void groupPrefixIsAppliedToKeys() {
    GrowableBuffer buf = new GrowableBuffer();
    plain.appendAttr(buf, Attr.string("k", "v"), "outer.");
    assertEquals("outer.k=v ", buf.toString());
  }

  @Test
  void errorsUseTheHighlightedPath() {
    Attr error = Attr.error("err", new IllegalStateException("connection refused"));
    assertEquals("err=\"connection refused\" ", render(plain, error));
    assertEquals(AnsiPalette.BLUE_CODE + "err=" + AnsiPalette.FAINT_CODE + "\"connection refused\""
        + AnsiPalette.RESET_CODE + " ", render(colored, error));
  }

  @Test
  void nullAnyRendersNil() {
    assertEquals("x=<nil> ", render(plain, new Attr("x", Value.ofAny(null))));
  }

  @Test
  void levelAndSourceValuesUseTheirOwnRendering() {
    assertEquals("lvl=WARN ", render(plain, Attr.any("lvl", Level.WARN)));
    assertEquals("src=orders/OrderService.java:12 submit ",
        render(plain, Attr.any("src", new Source("submit", "com/acme/orders/OrderService.java", 12))));
  }

  @Test
  void textMarshalersRenderTheirText() {
    TextMarshaler ok = () -> "marshaled value";
    TextMarshaler failing = () -> {
      throw new TextMarshalException("cannot marshal");
    };
    assertEquals("m=\"marshaled value\" ", render(plain, Attr.any("m", ok)));
    assertEquals("m= ", render(plain, Attr.any("m", failing)));
  }

  @Test
  void nullPointerFailureRendersNilAndLaterAttrsSurvive() {
    Object broken = new Object() {
      @Override
      public String toString() {
        String missing = null;
        return missing.trim();
      }
    };
    GrowableBuffer buf = new GrowableBuffer();
    plain.appendAttr(buf, Attr.any("bad", broken), "");
    plain.appendAttr(buf, Attr.string("next", "ok"), "");
    assertEquals("bad=<nil> next=ok ", buf.toString());
  }

  @Test
  void otherFailuresRenderQuotedPanicText() {
    Object broken = new Object() {
      @Override
      public String toString() {
        throw new IllegalStateException("boom");
      }
    };
    assertEquals("bad=\"!PANIC: boom\" ", render(plain, Attr.any("bad", broken)));
  }

  @Test
  void lazyValuesAreResolvedBeforeRendering() {
    LogValuer lazy = () -> Value.ofString("computed");
    assertEquals("lazy=computed ", render(plain, Attr.any("lazy", lazy)));
  }

  @Test
  void renderedPairsSplitBackIntoKeyAndValue() {
    String[] values = {"simple", "with space", "quote\"inside", "tab\tinside", ""};
    for (String original : values) {
      String rendered = render(plain, Attr.string("key", original));
      String pair = rendered.substring(0, rendered.length() - 1);
      int eq = pair.indexOf('=');
      assertEquals("key", pair.substring(0, eq));
      String value = pair.substring(eq + 1);
      assertEquals(original, unquote(value), rendered);
    }
  }

  @Test
  void plainTextUsesCompactForms() {
    assertEquals("1.5s", ValueEncoder.plainText(Duration.ofMillis(1_500)));
    assertEquals("0.25", ValueEncoder.plainText(0.25d));
    assertEquals("abc", ValueEncoder.plainText("abc"));
    assertEquals("null", ValueEncoder.plainText(null));
  }

  @Test
  void coloredQuotedStringsKeepEscapeCodes() {
    String rendered = render(colored, Attr.string("v", "\u001b[31mred\u001b[0m text"));
    assertTrue(rendered.contains("\"\u001b[31mred\u001b[0m text\""), rendered);
  }

  private static String render(ValueEncoder encoder, Attr attr) {
    GrowableBuffer buf = new GrowableBuffer();
    encoder.appendAttr(buf, attr, "");
    return buf.toString();
  }

  private static String unquote(String value) {
    if (!value.startsWith("\"")) {
      return value;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 1; i < value.length() - 1; i++) {
      char c = value.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      char next = value.charAt(++i);
      switch (next) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        default -> sb.append(next);
      }
    }
    return sb.toString();
  }
}

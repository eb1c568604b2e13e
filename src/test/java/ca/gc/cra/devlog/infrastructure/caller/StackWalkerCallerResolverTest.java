package ca.gc.cra.devlog.infrastructure.caller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.devlog.domain.CallSite;
import ca.gc.cra.devlog.domain.Source;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StackWalkerCallerResolverTest {
  private final StackWalkerCallerResolver resolver = new StackWalkerCallerResolver();

  @Test
  void resolvesCapturedCallSite() {
    CallSite site = new CallSite("com.acme.orders.OrderService", "lambda$submit$0", "OrderService.java", 42);

    Optional<Source> source = resolver.resolve(site);

    assertEquals(Optional.of(new Source("OrderService.lambda$submit$0", "orders/OrderService.java", 42)), source);
  }

  @Test
  void callSiteWithoutFileResolvesToNothing() {
    assertTrue(resolver.resolve(new CallSite("com.acme.Generated", "run", null, -1)).isEmpty());
    assertTrue(resolver.resolve((CallSite) null).isEmpty());
  }

  @Test
  void unknownLineBecomesZero() {
    Source source = resolver.resolve(new CallSite("Main", "main", "Main.java", -2)).orElseThrow();

    assertEquals(0, source.line());
    assertEquals("Main.java", source.file());
  }

  @Test
  void walkFindsTheCallingTestMethod() {
    Source source = resolver.resolve(0).orElseThrow();

    assertEquals("walkFindsTheCallingTestMethod", source.function());
    assertEquals("caller/StackWalkerCallerResolverTest.java", source.file());
    assertTrue(source.line() > 0);
  }

  @Test
  void walkSkipsHelperWhenAsked() {
    Source source = callThroughHelper();

    assertEquals("walkSkipsHelperWhenAsked", source.function());
  }

  @Test
  void negativeSkipIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> resolver.resolve(-1));
  }

  @Test
  void libraryFramesAreSkippedOutsideTests() {
    assertFalse(resolver.attributable(
        new CallSite("ca.gc.cra.devlog.infrastructure.sqltrace.SqlTraceLogger", "trace", "SqlTraceLogger.java", 10)));
    assertTrue(resolver.attributable(
        new CallSite("ca.gc.cra.devlog.FooTest", "query", "FooTest.java", 10)));
    assertTrue(resolver.attributable(new CallSite("com.acme.Repo", "find", "Repo.java", 10)));
  }

  @Test
  void generatedSourcesAreAlwaysSkipped() {
    assertFalse(resolver.attributable(new CallSite("com.acme.User_", "get", "User_.java", 3)));
    assertFalse(resolver.attributable(new CallSite("com.acme.Query", "run", "Query.gen.java", 3)));
  }

  @Test
  void extraLibraryPackagesAreSkipped() {
    StackWalkerCallerResolver hibernateAware = StackWalkerCallerResolver.forLibraries("org.hibernate.");

    assertFalse(hibernateAware.attributable(
        new CallSite("org.hibernate.engine.Loader", "load", "Loader.java", 7)));
    assertFalse(hibernateAware.attributable(
        new CallSite("ca.gc.cra.devlog.api.Loggers", "getLogger", "Loggers.java", 7)));
  }

  @Test
  void customFiltersReplaceDefaults() {
    StackWalkerCallerResolver custom = new StackWalkerCallerResolver(Set.of("com.acme."), Set.of());

    assertFalse(custom.attributable(new CallSite("com.acme.Repo", "find", "Repo.java", 1)));
    assertTrue(custom.attributable(new CallSite("com.acme.User_", "get", "User_.java", 1)));
  }

  private Source callThroughHelper() {
    return resolver.resolve(1).orElseThrow();
  }
}

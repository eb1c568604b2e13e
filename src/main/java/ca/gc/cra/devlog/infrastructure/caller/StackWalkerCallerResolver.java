package ca.gc.cra.devlog.infrastructure.caller;

import ca.gc.cra.devlog.application.port.CallerResolver;
import ca.gc.cra.devlog.domain.CallSite;
import ca.gc.cra.devlog.domain.Source;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CallerResolver} backed by {@link StackWalker}.
 * <p><strong>Why:</strong> Statement tracing runs deep inside data-access libraries; the interesting frame is the
 * first one that belongs to the application, not the library that issued the statement.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Convert a captured {@link CallSite} into a reduced {@link Source}.</li>
 *   <li>Walk the live stack, skipping frames from library packages (unless they come from a test source) and
 *   frames from generated sources.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Performance:</strong> The walk is lazy and bounded to {@value #MAX_FRAMES} frames.</p>
 *
 * @since 0.1.0
 */
public final class StackWalkerCallerResolver implements CallerResolver {
  private static final Logger log = LoggerFactory.getLogger(StackWalkerCallerResolver.class);

  /** Frames inspected per walk. */
  static final int MAX_FRAMES = 64;

  /** Package of this library; its own frames are never attributed. */
  public static final String LIBRARY_PACKAGE = "ca.gc.cra.devlog.";

  private static final List<String> TEST_FILE_SUFFIXES = List.of("Test.java", "Tests.java", "IT.java");
  private static final Set<String> DEFAULT_GENERATED_SUFFIXES = Set.of("_.java", ".gen.java");

  private static final StackWalker WALKER = StackWalker.getInstance();

  private final Set<String> libraryPackages;
  private final Set<String> generatedSuffixes;

  /**
   * Creates a resolver that skips this library's frames and JPA-metamodel style generated sources.
   */
  public StackWalkerCallerResolver() {
    this(Set.of(LIBRARY_PACKAGE), DEFAULT_GENERATED_SUFFIXES);
  }

  /**
   * Creates a resolver with explicit filters.
   *
   * @param libraryPackages class name prefixes whose frames are skipped unless declared in a test source,
   *     e.g. {@code org.hibernate.}
   * @param generatedSuffixes source file suffixes whose frames are always skipped
   */
  public StackWalkerCallerResolver(Set<String> libraryPackages, Set<String> generatedSuffixes) {
    this.libraryPackages = Set.copyOf(Objects.requireNonNull(libraryPackages, "libraryPackages"));
    this.generatedSuffixes = Set.copyOf(Objects.requireNonNull(generatedSuffixes, "generatedSuffixes"));
  }

  /**
   * Creates a resolver that also skips frames from the given data-access library packages.
   *
   * @param packages class name prefixes, e.g. {@code org.hibernate.}
   * @return resolver skipping this library and {@code packages}
   */
  public static StackWalkerCallerResolver forLibraries(String... packages) {
    Set<String> prefixes = new LinkedHashSet<>();
    prefixes.add(LIBRARY_PACKAGE);
    prefixes.addAll(List.of(packages));
    return new StackWalkerCallerResolver(prefixes, DEFAULT_GENERATED_SUFFIXES);
  }

  @Override
  public Optional<Source> resolve(CallSite callSite) {
    if (callSite == null || !callSite.hasFile()) {
      return Optional.empty();
    }
    return Optional.of(new Source(
        FunctionNames.shortName(callSite.qualifiedFunction()),
        SourcePaths.shortFile(callSite.filePath()),
        Math.max(0, callSite.lineNumber())));
  }

  @Override
  public Optional<Source> resolve(int skip) {
    if (skip < 0) {
      throw new IllegalArgumentException("skip must not be negative");
    }
    // the first frame is this method
    Optional<CallSite> frame = WALKER.walk(frames -> frames
        .skip(1L + skip)
        .limit(MAX_FRAMES)
        .map(CallSite::of)
        .filter(this::attributable)
        .findFirst());
    if (frame.isEmpty()) {
      log.debug("No attributable frame within {} frames", MAX_FRAMES);
      return Optional.empty();
    }
    CallSite site = frame.get();
    return Optional.of(new Source(
        site.methodName(),
        SourcePaths.shortFile(site.filePath()),
        Math.max(0, site.lineNumber())));
  }

  boolean attributable(CallSite site) {
    String file = site.fileName();
    for (String suffix : generatedSuffixes) {
      if (file.endsWith(suffix)) {
        return false;
      }
    }
    if (!inLibrary(site.className())) {
      return true;
    }
    for (String suffix : TEST_FILE_SUFFIXES) {
      if (file.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }

  private boolean inLibrary(String className) {
    for (String prefix : libraryPackages) {
      if (className.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}

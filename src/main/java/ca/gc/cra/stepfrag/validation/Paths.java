package ca.gc.cra.stepfrag.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Path validation utilities for STEPFRAG CLI and configuration flows.
 * <p><strong>Why:</strong> Catches malformed input and output locations at the boundary so conversion failures are
 * reserved for genuine read, parse and write errors.</p>
 * <p><strong>Role:</strong> Support utilities executed by configuration records before the orchestrator runs.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence of the input file is not checked here; the profiler and orchestrator report missing inputs
 * in their own terms.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user-supplied path string.
   *
   * @param name logical parameter name for diagnostics
   * @param raw textual path
   * @return normalized path
   * @throws IllegalArgumentException if the value is blank, contains control characters, or is not a valid path
   */
  public static Path parse(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(sanitized).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates an output file location.
   *
   * @param path candidate artifact path; must not be {@code null}
   * @return the same path
   * @throws IllegalArgumentException if the path names an existing directory or has no file name
   */
  public static Path validateOutputFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (path.getFileName() == null) {
      throw new IllegalArgumentException("output path has no file name: " + path);
    }
    if (Files.isDirectory(path)) {
      throw new IllegalArgumentException("output path is a directory: " + path);
    }
    return path;
  }

  /**
   * Replaces the extension of {@code input}'s file name and places the result beside it.
   *
   * @param input source file
   * @param extension new extension including the leading dot
   * @return sibling path with the replaced extension
   */
  public static Path withExtension(Path input, String extension) {
    String fileName = input.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return input.resolveSibling(stem + extension);
  }
}

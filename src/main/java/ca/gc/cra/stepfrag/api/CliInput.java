package ca.gc.cra.stepfrag.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command arguments split into {@code key=value} tokens and {@code --flags}.
 *
 * <p>Help ({@code --help}, {@code -h}, {@code help}) and verbose ({@code --verbose}, {@code -v}) are understood by
 * every command. Other dash-prefixed tokens without {@code '='} are kept lowercased for the command to check.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v");

  private final List<String> keyValues = new ArrayList<>();
  private final Set<String> flags = new LinkedHashSet<>();
  private boolean help;
  private boolean verbose;

  private CliInput() {}

  /**
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    CliInput input = new CliInput();
    if (args != null) {
      for (String raw : args) {
        if (raw != null && !raw.isBlank()) {
          input.accept(raw.trim());
        }
      }
    }
    return input;
  }

  private void accept(String token) {
    String lower = token.toLowerCase(Locale.ROOT);
    if (HELP_FLAGS.contains(lower)) {
      help = true;
    } else if (VERBOSE_FLAGS.contains(lower)) {
      verbose = true;
    } else if (token.startsWith("-") && token.indexOf('=') < 0) {
      flags.add(lower);
    } else {
      keyValues.add(token);
    }
  }

  /**
   * @return copy of the positional arguments
   */
  public String[] keyValueArgs() {
    return keyValues.toArray(String[]::new);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /** Case-insensitive check for a flag such as {@code --preflight}. */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * @param known flags the command accepts
   * @return flags outside {@code known}, in input order
   */
  public List<String> unknownFlags(Set<String> known) {
    return flags.stream().filter(flag -> !known.contains(flag)).toList();
  }
}

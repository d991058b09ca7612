package ca.gc.cra.trail.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into positional words, {@code key=value} settings, and flags.
 *
 * <p>{@code --help}/{@code -h} and {@code --verbose}/{@code -v} are recognised anywhere. Other arguments starting
 * with {@code -} and lacking {@code =} are kept as lower-case flags.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v");

  private final List<String> words;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(List<String> words, Set<String> flags, boolean help, boolean verbose) {
    this.words = words;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw arguments; {@code null} and blank entries are ignored
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), Set.of(), false, false);
    }
    List<String> words = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        words.add(arg);
      }
    }
    return new CliInput(List.copyOf(words), Collections.unmodifiableSet(flags), help, verbose);
  }

  /**
   * Returns the arguments that are neither help, verbose, nor other flags, in their original order.
   *
   * @return copy of the remaining arguments
   */
  public String[] keyValueArgs() {
    return words.toArray(String[]::new);
  }

  /**
   * Returns the same input without its first word, for handing to a subcommand.
   *
   * @return input minus the command word
   */
  CliInput withoutCommand() {
    List<String> rest = words.isEmpty() ? List.of() : words.subList(1, words.size());
    return new CliInput(List.copyOf(rest), flags, help, verbose);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Returns flags other than help and verbose, lower-cased.
   *
   * @return flags in the order given
   */
  public Set<String> flags() {
    return flags;
  }
}

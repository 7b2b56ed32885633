package ca.gc.cra.fmtlog.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line tokens of one subcommand, split into normalized flags and {@code key=value} tokens.
 *
 * @param tokens non-flag tokens in command-line order; tokens carrying {@code =} keep their surrounding
 *     whitespace so template values may start or end with spaces
 * @param flags normalized lowercase flags; aliases collapse to {@code --help} and {@code --verbose}
 */
public record CliInput(List<String> tokens, Set<String> flags) {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose");

  public CliInput {
    tokens = List.copyOf(tokens);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Blank tokens are dropped; a token starting with {@code -} and holding no
   * {@code =} is a flag.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> tokens = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (ALIASES.containsKey(lower)) {
          flags.add(ALIASES.get(lower));
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          tokens.add(arg.contains("=") ? raw : arg);
        }
      }
    }
    return new CliInput(tokens, flags);
  }

  /**
   * Returns the non-flag tokens as a fresh array for {@link CliArgsParser#toMap(String[])}.
   *
   * @return tokens in command-line order
   */
  public String[] keyValueArgs() {
    return tokens.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --no-color} was supplied.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}

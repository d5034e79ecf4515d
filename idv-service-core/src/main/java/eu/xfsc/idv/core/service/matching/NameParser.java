package eu.xfsc.idv.core.service.matching;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits a profile display name into given and family components.
 *
 * <p>Supported forms are {@code "Family, Given"}, {@code "Given Family"} and
 * {@code "Given Middle Family"}; in the last form every token but the final one belongs to the given name.</p>
 */
public final class NameParser {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private NameParser() {
  }

  /**
   * Parses a display name.
   *
   * @param displayName free text name, may be {@code null}
   * @return the parsed components; both empty for empty input
   */
  public static ParsedName parse(String displayName) {
    String trimmed = displayName == null ? "" : displayName.trim();
    if (trimmed.isEmpty()) {
      return ParsedName.EMPTY;
    }

    int comma = trimmed.indexOf(',');
    if (comma >= 0) {
      String family = trimmed.substring(0, comma).trim();
      String given = Arrays.stream(trimmed.substring(comma + 1).split(","))
          .map(String::trim)
          .collect(Collectors.joining(" "))
          .trim();
      return new ParsedName(given, family);
    }

    String[] tokens = WHITESPACE.split(trimmed);
    if (tokens.length == 1) {
      return new ParsedName(tokens[0], "");
    }
    String given = String.join(" ", Arrays.copyOfRange(tokens, 0, tokens.length - 1));
    return new ParsedName(given, tokens[tokens.length - 1]);
  }
}

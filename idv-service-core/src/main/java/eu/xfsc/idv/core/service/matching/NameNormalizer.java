package eu.xfsc.idv.core.service.matching;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes names for comparison: upper case, diacritics stripped, only letters and single spaces kept.
 */
public final class NameNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}\\p{Zs}\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("[\\p{Zs}\\s]+");

  private NameNormalizer() {
  }

  /**
   * Returns the canonical form of a name. {@code null}, empty and blank input all yield an empty string.
   * Applying the function to its own output returns the output unchanged.
   *
   * @param name the raw name, as printed on a document or typed into a profile
   * @return the canonical form
   */
  public static String normalize(String name) {
    if (name == null || name.isBlank()) {
      return "";
    }
    String upper = name.toUpperCase(Locale.ROOT);
    String decomposed = Normalizer.normalize(upper, Normalizer.Form.NFD);
    String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
    String lettersOnly = NON_LETTERS.matcher(stripped).replaceAll("");
    return WHITESPACE.matcher(lettersOnly).replaceAll(" ").trim();
  }
}

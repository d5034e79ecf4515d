package eu.xfsc.idv.core.service.matching;

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Edit-distance similarity between names, tolerant of the character-level errors OCR tends to make.
 */
public final class SimilarityScorer {

  /** Unbounded instance: always the exact distance, never a threshold cut-off. */
  private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

  private SimilarityScorer() {
  }

  /**
   * Computes {@code 1 - distance / max(length)} over the canonical forms of both names, where distance is the
   * Levenshtein distance with unit costs. Identical canonical forms score 1.0; an empty canonical form on either
   * side (but not both) scores 0.0.
   *
   * @param first a raw name
   * @param second another raw name
   * @return similarity in [0, 1]
   */
  public static double similarity(String first, String second) {
    String a = NameNormalizer.normalize(first);
    String b = NameNormalizer.normalize(second);
    if (a.equals(b)) {
      return 1.0;
    }
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    int distance = LEVENSHTEIN.apply(a, b);
    return 1.0 - (double) distance / Math.max(a.length(), b.length());
  }
}

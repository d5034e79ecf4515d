package eu.xfsc.idv.core.service.matching;

/**
 * How the document's given and family names map onto the profile's parsed components.
 */
public enum NameOrientation {

  /** Document given name against profile given name, family against family. */
  NATURAL {
    @Override
    String profileCounterpartOfGiven(ParsedName profile) {
      return profile.given();
    }

    @Override
    String profileCounterpartOfFamily(ParsedName profile) {
      return profile.family();
    }
  },

  /** Document given name against profile family name and vice versa, for family-name-first presentations. */
  SWAPPED {
    @Override
    String profileCounterpartOfGiven(ParsedName profile) {
      return profile.family();
    }

    @Override
    String profileCounterpartOfFamily(ParsedName profile) {
      return profile.given();
    }
  };

  abstract String profileCounterpartOfGiven(ParsedName profile);

  abstract String profileCounterpartOfFamily(ParsedName profile);

  /**
   * Scores the document name against the profile name under this orientation.
   *
   * @param documentGiven given name read from the document
   * @param documentFamily family name read from the document
   * @param profile parsed profile name
   * @return the component scores and the profile values they were computed against
   */
  public OrientationScore score(String documentGiven, String documentFamily, ParsedName profile) {
    String profileGiven = profileCounterpartOfGiven(profile);
    String profileFamily = profileCounterpartOfFamily(profile);
    return new OrientationScore(this, profileGiven, profileFamily,
        SimilarityScorer.similarity(documentGiven, profileGiven),
        SimilarityScorer.similarity(documentFamily, profileFamily));
  }

  /**
   * Component scores for one orientation.
   *
   * @param orientation the orientation that produced the scores
   * @param profileGiven profile value compared with the document given name
   * @param profileFamily profile value compared with the document family name
   * @param givenScore similarity of the given-name pair
   * @param familyScore similarity of the family-name pair
   */
  public record OrientationScore(NameOrientation orientation, String profileGiven, String profileFamily,
      double givenScore, double familyScore) {

    public double aggregate() {
      return (givenScore + familyScore) / 2;
    }
  }
}

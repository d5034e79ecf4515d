package eu.xfsc.idv.core.service.matching;

import java.util.Arrays;

import org.springframework.stereotype.Component;

import eu.xfsc.idv.core.pojo.NameComponentMatch;
import eu.xfsc.idv.core.pojo.NameMatchResult;
import eu.xfsc.idv.core.service.matching.NameOrientation.OrientationScore;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link NameMatchService} interface.
 * Scores every {@link NameOrientation} independently and keeps the one with the highest aggregate;
 * ties go to {@link NameOrientation#NATURAL}.
 */
@Slf4j
@Component
public class NameMatchServiceImpl implements NameMatchService {

  /** Aggregate similarity required for an overall pass. */
  public static final double NAME_MATCH_THRESHOLD = 0.85;
  /** Similarity at which a single name component counts as matched. */
  public static final double COMPONENT_MATCH_THRESHOLD = 0.8;

  @Override
  public NameMatchResult matchNames(String documentGiven, String documentFamily, String profileDisplayName) {
    String given = documentGiven == null ? "" : documentGiven;
    String family = documentFamily == null ? "" : documentFamily;
    ParsedName profile = NameParser.parse(profileDisplayName);

    OrientationScore best;
    if (NameNormalizer.normalize(given + " " + family).isEmpty()
        || NameNormalizer.normalize(profileDisplayName).isEmpty()) {
      // nothing to compare on one side; empty-vs-empty components must not count as identical
      best = new OrientationScore(NameOrientation.NATURAL, profile.given(), profile.family(), 0.0, 0.0);
    } else {
      best = Arrays.stream(NameOrientation.values())
          .map(orientation -> orientation.score(given, family, profile))
          .reduce((current, candidate) -> candidate.aggregate() > current.aggregate() ? candidate : current)
          .orElseThrow();
    }

    boolean givenMatch = best.givenScore() >= COMPONENT_MATCH_THRESHOLD;
    boolean familyMatch = best.familyScore() >= COMPONENT_MATCH_THRESHOLD;
    double score = best.aggregate();
    boolean passed = score >= NAME_MATCH_THRESHOLD && (givenMatch || familyMatch);
    log.debug("matchNames; orientation: {}, given score: {}, family score: {}, aggregate: {}, passed: {}",
        best.orientation(), best.givenScore(), best.familyScore(), score, passed);

    return NameMatchResult.builder()
        .score(score)
        .passed(passed)
        .firstName(new NameComponentMatch(given, best.profileGiven(), givenMatch, best.givenScore()))
        .lastName(new NameComponentMatch(family, best.profileFamily(), familyMatch, best.familyScore()))
        .build();
  }

}

package eu.xfsc.idv.core.service.matching;

import eu.xfsc.idv.core.pojo.NameMatchResult;

/**
 * Compares the name printed on an identity document with the name on the user's profile.
 *
 * @see NameMatchServiceImpl
 */
public interface NameMatchService {

  /**
   * Matches document name fields against a free-form profile display name, trying both the natural and the
   * swapped orientation and keeping the better one. Never throws; empty or {@code null} input yields a
   * well-formed, failing result.
   *
   * @param documentGiven given name extracted from the document
   * @param documentFamily family name extracted from the document
   * @param profileDisplayName the profile display name
   * @return the match result for the selected orientation
   */
  NameMatchResult matchNames(String documentGiven, String documentFamily, String profileDisplayName);

}

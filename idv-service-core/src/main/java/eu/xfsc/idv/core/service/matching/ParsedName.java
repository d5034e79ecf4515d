package eu.xfsc.idv.core.service.matching;

/**
 * Given and family components of a free-form display name. Neither component is ever {@code null}.
 */
public record ParsedName(String given, String family) {

  static final ParsedName EMPTY = new ParsedName("", "");

}

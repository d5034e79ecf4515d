package eu.xfsc.idv.core.pojo;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO Class for holding the result of comparing a document name against a profile name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"score", "passed", "firstName", "lastName"})
public class NameMatchResult {

  /** Aggregate similarity of the selected orientation, in [0, 1]. */
  private double score;
  private boolean passed;
  private NameComponentMatch firstName;
  private NameComponentMatch lastName;

}

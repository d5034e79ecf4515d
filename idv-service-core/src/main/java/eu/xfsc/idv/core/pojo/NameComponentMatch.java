package eu.xfsc.idv.core.pojo;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Match outcome for one name field (given or family): the value printed on the document,
 * the profile value it was compared with under the selected orientation, the component score and its match flag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"documentValue", "profileValue", "match", "score"})
public class NameComponentMatch {

  private String documentValue;
  private String profileValue;
  private boolean match;
  private double score;

}

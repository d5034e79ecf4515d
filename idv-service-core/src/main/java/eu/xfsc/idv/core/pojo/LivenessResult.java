package eu.xfsc.idv.core.pojo;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Liveness check outcome: pass flag, the challenges completed in order and the time taken.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"passed", "challenges", "duration"})
public class LivenessResult {

  private boolean passed;
  private List<String> challenges;
  private Duration duration;

}

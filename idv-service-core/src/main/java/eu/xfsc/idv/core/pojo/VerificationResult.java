package eu.xfsc.idv.core.pojo;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a single verification attempt. The face match and liveness check are {@code null}
 * when the corresponding check was not attempted. Instances are never persisted by the core.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"nameMatch", "faceMatch", "livenessCheck", "timestamp", "documentType", "issuingCountry"})
public class VerificationResult {

  private NameMatchResult nameMatch;
  private FaceMatchResult faceMatch;
  private LivenessResult livenessCheck;
  private Instant timestamp;
  /** Document type code, e.g. {@code PASSPORT} or {@code ID_CARD}. */
  private String documentType;
  /** Three-letter ISO 3166 country code of the issuing state. */
  private String issuingCountry;

}

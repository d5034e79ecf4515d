package eu.xfsc.idv.core.pojo;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Face comparison outcome reported by the biometric detection collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"score", "passed", "documentFaceDetected", "profileFaceDetected", "selfieFaceDetected"})
public class FaceMatchResult {

  private double score;
  private boolean passed;
  private boolean documentFaceDetected;
  private boolean profileFaceDetected;
  private boolean selfieFaceDetected;

}

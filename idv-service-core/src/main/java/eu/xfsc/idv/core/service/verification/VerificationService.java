package eu.xfsc.idv.core.service.verification;

import java.util.List;

import eu.xfsc.idv.core.pojo.FaceMatchResult;
import eu.xfsc.idv.core.pojo.LivenessResult;
import eu.xfsc.idv.core.pojo.NameMatchResult;
import eu.xfsc.idv.core.pojo.VerificationLevel;
import eu.xfsc.idv.core.pojo.VerificationResult;

/**
 * Combines name, face and liveness evidence into a verification result and classifies it.
 *
 * <p>Face match and liveness are optional: a check that was never attempted is ignored,
 * but an attempted check that failed vetoes the overall pass.</p>
 *
 * @see VerificationServiceImpl
 */
public interface VerificationService {

  /**
   * Assembles a verification result stamped with the current time.
   *
   * @param nameMatch the name match outcome
   * @param documentType document type code, e.g. {@code PASSPORT}
   * @param issuingCountry three-letter ISO country code of the issuer
   * @param faceMatch face match outcome, or {@code null} if not attempted
   * @param livenessCheck liveness outcome, or {@code null} if not attempted
   * @return the assembled result
   */
  VerificationResult createVerificationResult(NameMatchResult nameMatch, String documentType, String issuingCountry,
      FaceMatchResult faceMatch, LivenessResult livenessCheck);

  /**
   * Builds a face match result from raw detector output, applying the face similarity threshold.
   *
   * @param score face similarity reported by the detector
   * @param documentFaceDetected whether a face was found in the document photo
   * @param profileFaceDetected whether a face was found in the profile photo
   * @param selfieFaceDetected whether a face was found in the live selfie
   * @return the face match result; passed only if every face was detected and the score clears the threshold
   */
  FaceMatchResult evaluateFaceMatch(double score, boolean documentFaceDetected, boolean profileFaceDetected,
      boolean selfieFaceDetected);

  /**
   * Classifies the trust level of a result.
   *
   * @param result the verification result
   * @return {@link VerificationLevel#NONE} if the name did not match, {@link VerificationLevel#ENHANCED} if the
   *     name, face and liveness checks all passed, {@link VerificationLevel#BASIC} otherwise
   */
  VerificationLevel getVerificationLevel(VerificationResult result);

  /**
   * @param result the verification result
   * @return true if the name matched and no attempted optional check failed
   */
  boolean isVerificationPassed(VerificationResult result);

  /**
   * Lists every applicable failure reason, name first, then face, then liveness.
   *
   * @param result the verification result
   * @return the reasons; empty exactly when {@link #isVerificationPassed(VerificationResult)} is true
   */
  List<String> getVerificationFailureReasons(VerificationResult result);

}

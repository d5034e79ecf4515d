package eu.xfsc.idv.core.service.verification;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import eu.xfsc.idv.core.pojo.FaceMatchResult;
import eu.xfsc.idv.core.pojo.LivenessResult;
import eu.xfsc.idv.core.pojo.NameMatchResult;
import eu.xfsc.idv.core.pojo.VerificationLevel;
import eu.xfsc.idv.core.pojo.VerificationResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link VerificationService} interface.
 */
@Slf4j
@Component
public class VerificationServiceImpl implements VerificationService {

  /** Face similarity required for a face match to pass. */
  public static final double FACE_MATCH_THRESHOLD = 0.70;

  private final Clock clock;

  @Autowired
  public VerificationServiceImpl(Clock clock) {
    this.clock = clock;
  }

  @Override
  public VerificationResult createVerificationResult(NameMatchResult nameMatch, String documentType,
      String issuingCountry, FaceMatchResult faceMatch, LivenessResult livenessCheck) {
    return VerificationResult.builder()
        .nameMatch(nameMatch)
        .faceMatch(faceMatch)
        .livenessCheck(livenessCheck)
        .timestamp(Instant.now(clock))
        .documentType(documentType)
        .issuingCountry(issuingCountry)
        .build();
  }

  @Override
  public FaceMatchResult evaluateFaceMatch(double score, boolean documentFaceDetected, boolean profileFaceDetected,
      boolean selfieFaceDetected) {
    boolean allDetected = documentFaceDetected && profileFaceDetected && selfieFaceDetected;
    return FaceMatchResult.builder()
        .score(score)
        .passed(allDetected && score >= FACE_MATCH_THRESHOLD)
        .documentFaceDetected(documentFaceDetected)
        .profileFaceDetected(profileFaceDetected)
        .selfieFaceDetected(selfieFaceDetected)
        .build();
  }

  @Override
  public VerificationLevel getVerificationLevel(VerificationResult result) {
    if (!nameMatchPassed(result)) {
      return VerificationLevel.NONE;
    }
    if (faceMatchPassed(result) && livenessPassed(result)) {
      return VerificationLevel.ENHANCED;
    }
    return VerificationLevel.BASIC;
  }

  @Override
  public boolean isVerificationPassed(VerificationResult result) {
    if (!nameMatchPassed(result)) {
      return false;
    }
    if (result.getFaceMatch() != null && !result.getFaceMatch().isPassed()) {
      return false;
    }
    return result.getLivenessCheck() == null || result.getLivenessCheck().isPassed();
  }

  @Override
  public List<String> getVerificationFailureReasons(VerificationResult result) {
    List<VerificationFailureReason> reasons = new ArrayList<>();

    NameMatchResult nameMatch = result.getNameMatch();
    if (!nameMatchPassed(result)) {
      boolean firstMatch = nameMatch != null && nameMatch.getFirstName() != null && nameMatch.getFirstName().isMatch();
      boolean lastMatch = nameMatch != null && nameMatch.getLastName() != null && nameMatch.getLastName().isMatch();
      if (firstMatch && !lastMatch) {
        reasons.add(VerificationFailureReason.LAST_NAME_MISMATCH);
      } else if (!firstMatch && lastMatch) {
        reasons.add(VerificationFailureReason.FIRST_NAME_MISMATCH);
      } else {
        // neither component matched, or both did but the aggregate stayed below the threshold
        reasons.add(VerificationFailureReason.NAME_MISMATCH);
      }
    }

    FaceMatchResult faceMatch = result.getFaceMatch();
    if (faceMatch != null && !faceMatch.isPassed()) {
      if (!faceMatch.isDocumentFaceDetected()) {
        reasons.add(VerificationFailureReason.DOCUMENT_FACE_NOT_DETECTED);
      } else if (!faceMatch.isProfileFaceDetected()) {
        reasons.add(VerificationFailureReason.PROFILE_FACE_NOT_DETECTED);
      } else {
        reasons.add(VerificationFailureReason.FACE_MISMATCH);
      }
    }

    LivenessResult liveness = result.getLivenessCheck();
    if (liveness != null && !liveness.isPassed()) {
      reasons.add(VerificationFailureReason.LIVENESS_FAILED);
    }

    if (!reasons.isEmpty()) {
      log.debug("getVerificationFailureReasons; reasons: {}", reasons);
    }
    return reasons.stream().map(VerificationFailureReason::getMessage).toList();
  }

  private static boolean nameMatchPassed(VerificationResult result) {
    return result.getNameMatch() != null && result.getNameMatch().isPassed();
  }

  private static boolean faceMatchPassed(VerificationResult result) {
    return result.getFaceMatch() != null && result.getFaceMatch().isPassed();
  }

  private static boolean livenessPassed(VerificationResult result) {
    return result.getLivenessCheck() != null && result.getLivenessCheck().isPassed();
  }
}

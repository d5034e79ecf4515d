package eu.xfsc.idv.core.service.verification;

/**
 * Human-readable reasons a verification result did not pass.
 */
public enum VerificationFailureReason {
  NAME_MISMATCH("Name does not match profile"),
  FIRST_NAME_MISMATCH("First name does not match"),
  LAST_NAME_MISMATCH("Last name does not match"),
  DOCUMENT_FACE_NOT_DETECTED("Could not detect face in passport photo"),
  PROFILE_FACE_NOT_DETECTED("Could not detect face in profile photo"),
  FACE_MISMATCH("Face does not match profile photo"),
  LIVENESS_FAILED("Liveness check failed");

  private final String message;

  VerificationFailureReason(String message) {
    this.message = message;
  }

  public String getMessage() {
    return message;
  }
}

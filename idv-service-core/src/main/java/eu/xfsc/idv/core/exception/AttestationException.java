package eu.xfsc.idv.core.exception;

/**
 * Exception thrown when a signed attestation cannot be produced or its payload cannot be read back.
 */
public class AttestationException extends ServiceException {

  /**
   * Constructs a new AttestationException with the specified detail message.
   *
   * @param message Detailed message about the thrown exception.
   */
  public AttestationException(String message) {
    super(message);
  }

  public AttestationException(String message, Throwable cause) {
    super(message, cause);
  }
}

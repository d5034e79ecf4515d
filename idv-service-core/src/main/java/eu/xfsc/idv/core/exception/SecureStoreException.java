package eu.xfsc.idv.core.exception;

/**
 * Exception thrown when the secure key-value store cannot read, write or delete an entry.
 * Carries the storage key involved so callers can report which entry failed.
 */
public class SecureStoreException extends ServiceException {

  private final String storageKey;

  /**
   * Constructs a new SecureStoreException.
   *
   * @param storageKey the key of the entry being accessed
   * @param message Detailed message about the thrown exception.
   * @param cause The underlying storage failure, may be {@code null}.
   */
  public SecureStoreException(String storageKey, String message, Throwable cause) {
    super(message, cause);
    this.storageKey = storageKey;
  }

  public SecureStoreException(String storageKey, String message) {
    this(storageKey, message, null);
  }

  public String getStorageKey() {
    return storageKey;
  }
}

package eu.xfsc.idv.core.service.attestation;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import eu.xfsc.idv.core.service.securestore.SecureStore;
import eu.xfsc.idv.core.util.FutureUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the per-installation signing key.
 *
 * <p>The key is read from the {@link SecureStore} on first use and created there if absent. Lookup and creation
 * run at most once at a time: concurrent callers share a single in-flight future, so only one key is ever
 * generated. A successful lookup is memoized; a failed one is forgotten so that a later call can try again.</p>
 */
@Slf4j
@Component
public class DeviceKeyProvider {

  /** Number of random bytes in a device key; rendered as twice as many hex characters. */
  static final int KEY_LENGTH_BYTES = 32;

  private final SecureStore secureStore;
  private final SecureRandom secureRandom;
  private final String storageKey;
  private final AtomicReference<CompletableFuture<String>> deviceKey = new AtomicReference<>();

  @Autowired
  public DeviceKeyProvider(SecureStore secureStore, SecureRandom secureRandom,
      @Value("${idv.attestation.key-storage-key:verification_device_key}") String storageKey) {
    this.secureStore = secureStore;
    this.secureRandom = secureRandom;
    this.storageKey = storageKey;
  }

  /**
   * Returns the device key, creating and persisting it on first use.
   *
   * @return the key as 64 lowercase hex characters; the future fails with the storage error if
   *     the secure store cannot be read or written
   */
  public CompletableFuture<String> getOrCreateDeviceKey() {
    CompletableFuture<String> existing = deviceKey.get();
    if (existing != null) {
      return existing.copy();
    }
    CompletableFuture<String> pending = new CompletableFuture<>();
    if (!deviceKey.compareAndSet(null, pending)) {
      return deviceKey.get().copy();
    }
    // a store that throws instead of failing its future must not leave the slot pending forever
    CompletableFuture.completedFuture(storageKey).thenCompose(ignored -> loadOrCreate()).whenComplete((key, error) -> {
      if (error != null) {
        Throwable cause = FutureUtils.unwrap(error);
        log.warn("getOrCreateDeviceKey; device key unavailable: {}", cause.getMessage());
        deviceKey.compareAndSet(pending, null);
        pending.completeExceptionally(cause);
      } else {
        pending.complete(key);
      }
    });
    return pending.copy();
  }

  private CompletableFuture<String> loadOrCreate() {
    return secureStore.get(storageKey).thenCompose(stored -> stored
        .filter(value -> !value.isBlank())
        .map(CompletableFuture::completedFuture)
        .orElseGet(this::createAndPersist));
  }

  private CompletableFuture<String> createAndPersist() {
    byte[] bytes = new byte[KEY_LENGTH_BYTES];
    secureRandom.nextBytes(bytes);
    String key = HexFormat.of().formatHex(bytes);
    return secureStore.set(storageKey, key).thenApply(done -> {
      log.info("createAndPersist; created device signing key under '{}'", storageKey);
      return key;
    });
  }

}

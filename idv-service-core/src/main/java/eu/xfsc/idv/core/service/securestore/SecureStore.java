package eu.xfsc.idv.core.service.securestore;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Secure key-value storage supplied by the host environment (keychain, keystore or similar).
 * All operations are asynchronous; a failing backend completes the returned future exceptionally,
 * typically with a {@link eu.xfsc.idv.core.exception.SecureStoreException}.
 */
public interface SecureStore {

    /**
     * Reads the value stored under a key.
     *
     * @param key the storage key
     * @return the stored value, or an empty optional if nothing is stored under the key
     */
    CompletableFuture<Optional<String>> get(String key);

    /**
     * Stores a value, replacing any previous value under the same key.
     *
     * @param key the storage key
     * @param value the value to store
     * @return a future completing once the value is durable
     */
    CompletableFuture<Void> set(String key, String value);

    /**
     * Removes the value stored under a key. Deleting a missing key is not an error.
     *
     * @param key the storage key
     * @return a future completing once the value is gone
     */
    CompletableFuture<Void> delete(String key);

}

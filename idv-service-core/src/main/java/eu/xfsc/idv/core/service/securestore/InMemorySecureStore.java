package eu.xfsc.idv.core.service.securestore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link SecureStore} backed by a concurrent map. Values live as long as the instance does,
 * so sharing one instance between signers simulates an application restart against the same storage.
 */
@Component
@ConditionalOnProperty(value = "securestore.impl", havingValue = "memory")
public class InMemorySecureStore implements SecureStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<String>> get(String key) {
        return CompletableFuture.completedFuture(Optional.ofNullable(entries.get(key)));
    }

    @Override
    public CompletableFuture<Void> set(String key, String value) {
        entries.put(key, value);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        entries.remove(key);
        return CompletableFuture.completedFuture(null);
    }

}

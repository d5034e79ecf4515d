package eu.xfsc.idv.core.service.attestation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import eu.xfsc.idv.core.exception.SecureStoreException;
import eu.xfsc.idv.core.service.securestore.InMemorySecureStore;
import eu.xfsc.idv.core.service.securestore.SecureStore;

@ExtendWith(MockitoExtension.class)
class DeviceKeyProviderTest {

  private static final String STORAGE_KEY = "verification_device_key";

  @Mock
  private SecureStore failingStore;

  private static DeviceKeyProvider provider(SecureStore store) {
    return new DeviceKeyProvider(store, new SecureRandom(), STORAGE_KEY);
  }

  @Test
  void getOrCreateDeviceKey_emptyStore_createsHexKeyAndPersistsIt() {
    InMemorySecureStore store = new InMemorySecureStore();

    String key = provider(store).getOrCreateDeviceKey().join();

    assertEquals(64, key.length());
    assertTrue(key.matches("[0-9a-f]{64}"));
    assertEquals(Optional.of(key), store.get(STORAGE_KEY).join());
  }

  @Test
  void getOrCreateDeviceKey_sequentialCalls_returnSameKey() {
    DeviceKeyProvider provider = provider(new InMemorySecureStore());

    assertEquals(provider.getOrCreateDeviceKey().join(), provider.getOrCreateDeviceKey().join());
  }

  @Test
  void getOrCreateDeviceKey_afterRestart_returnsPersistedKey() {
    InMemorySecureStore store = new InMemorySecureStore();
    String first = provider(store).getOrCreateDeviceKey().join();

    String afterRestart = provider(store).getOrCreateDeviceKey().join();

    assertEquals(first, afterRestart);
  }

  @Test
  void getOrCreateDeviceKey_existingKey_isNotReplaced() {
    InMemorySecureStore store = new InMemorySecureStore();
    store.set(STORAGE_KEY, "ab".repeat(32)).join();

    assertEquals("ab".repeat(32), provider(store).getOrCreateDeviceKey().join());
  }

  @Test
  void getOrCreateDeviceKey_concurrentCallers_shareSingleCreation() throws Exception {
    GatedSecureStore store = new GatedSecureStore();
    DeviceKeyProvider provider = provider(store);
    int callers = 8;
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    CountDownLatch started = new CountDownLatch(callers);
    try {
      List<Future<CompletableFuture<String>>> calls = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        calls.add(executor.submit(() -> {
          started.countDown();
          return provider.getOrCreateDeviceKey();
        }));
      }
      assertTrue(started.await(5, TimeUnit.SECONDS));
      List<CompletableFuture<String>> keys = new ArrayList<>();
      for (Future<CompletableFuture<String>> call : calls) {
        keys.add(call.get(5, TimeUnit.SECONDS));
      }
      assertFalse(keys.get(0).isDone());

      store.open();

      Set<String> distinct = new HashSet<>();
      for (CompletableFuture<String> key : keys) {
        distinct.add(key.get(5, TimeUnit.SECONDS));
      }
      assertEquals(1, distinct.size());
      assertEquals(1, store.writes.get());
      assertEquals(1, store.reads.get());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void getOrCreateDeviceKey_storageFailure_propagatesWithoutRetry() {
    when(failingStore.get(STORAGE_KEY))
        .thenReturn(CompletableFuture.failedFuture(new SecureStoreException(STORAGE_KEY, "keychain locked")));
    DeviceKeyProvider provider = provider(failingStore);

    CompletionException ex = assertThrows(CompletionException.class, () -> provider.getOrCreateDeviceKey().join());

    SecureStoreException cause = assertInstanceOf(SecureStoreException.class, ex.getCause());
    assertEquals(STORAGE_KEY, cause.getStorageKey());
    verify(failingStore, times(1)).get(STORAGE_KEY);
    verify(failingStore, never()).set(anyString(), anyString());
  }

  @Test
  void getOrCreateDeviceKey_afterFailure_nextCallReadsStoreAgain() {
    when(failingStore.get(STORAGE_KEY))
        .thenReturn(CompletableFuture.failedFuture(new SecureStoreException(STORAGE_KEY, "keychain locked")))
        .thenReturn(CompletableFuture.completedFuture(Optional.of("cd".repeat(32))));
    DeviceKeyProvider provider = provider(failingStore);

    assertThrows(CompletionException.class, () -> provider.getOrCreateDeviceKey().join());
    assertEquals("cd".repeat(32), provider.getOrCreateDeviceKey().join());
    verify(failingStore, times(2)).get(eq(STORAGE_KEY));
  }

  @Test
  void getOrCreateDeviceKey_storeThrowsSynchronously_failsAndAllowsNextCall() throws Exception {
    when(failingStore.get(STORAGE_KEY))
        .thenThrow(new SecureStoreException(STORAGE_KEY, "keychain unavailable"))
        .thenReturn(CompletableFuture.completedFuture(Optional.of("ef".repeat(32))));
    DeviceKeyProvider provider = provider(failingStore);

    CompletableFuture<String> first = provider.getOrCreateDeviceKey();
    assertTrue(first.isCompletedExceptionally());
    CompletionException ex = assertThrows(CompletionException.class, first::join);
    assertInstanceOf(SecureStoreException.class, ex.getCause());

    assertEquals("ef".repeat(32), provider.getOrCreateDeviceKey().get(2, TimeUnit.SECONDS));
    verify(failingStore, times(2)).get(STORAGE_KEY);
  }

  @Test
  void getOrCreateDeviceKey_writeFailure_propagates() {
    when(failingStore.get(STORAGE_KEY)).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
    when(failingStore.set(eq(STORAGE_KEY), anyString()))
        .thenReturn(CompletableFuture.failedFuture(new SecureStoreException(STORAGE_KEY, "disk full")));

    CompletionException ex = assertThrows(CompletionException.class,
        () -> provider(failingStore).getOrCreateDeviceKey().join());

    assertInstanceOf(SecureStoreException.class, ex.getCause());
  }

  /**
   * Store whose reads stay pending until {@link #open()} is called.
   */
  private static class GatedSecureStore extends InMemorySecureStore {

    private final CompletableFuture<Void> gate = new CompletableFuture<>();
    private final AtomicInteger reads = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();

    void open() {
      gate.complete(null);
    }

    @Override
    public CompletableFuture<Optional<String>> get(String key) {
      reads.incrementAndGet();
      return gate.thenCompose(ignored -> super.get(key));
    }

    @Override
    public CompletableFuture<Void> set(String key, String value) {
      writes.incrementAndGet();
      return super.set(key, value);
    }
  }
}

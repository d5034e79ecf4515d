package eu.xfsc.idv.core.service.attestation;

import java.util.concurrent.CompletableFuture;

/**
 * Supplies the identifier of the device installation that signs attestations.
 */
public interface DeviceIdProvider {

  /**
   * @return the device identifier; the future fails if the identifier cannot be obtained
   */
  CompletableFuture<String> getDeviceId();

}

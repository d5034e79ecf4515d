package eu.xfsc.idv.core.service.attestation;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import eu.xfsc.idv.core.exception.AttestationException;

/**
 * {@link DeviceIdProvider} reading the identifier the host registered under {@code idv.attestation.device-id}.
 */
@Component
public class ConfiguredDeviceIdProvider implements DeviceIdProvider {

  @Value("${idv.attestation.device-id:}")
  private String deviceId;

  /** Package-private for testing. */
  void setDeviceId(String deviceId) {
    this.deviceId = deviceId;
  }

  @Override
  public CompletableFuture<String> getDeviceId() {
    if (deviceId == null || deviceId.isBlank()) {
      return CompletableFuture.failedFuture(new AttestationException("Device identifier is not configured"));
    }
    return CompletableFuture.completedFuture(deviceId);
  }

}

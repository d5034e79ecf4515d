package eu.xfsc.idv.core.service.attestation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import eu.xfsc.idv.core.exception.AttestationException;
import eu.xfsc.idv.core.pojo.SignedAttestation;
import eu.xfsc.idv.core.pojo.VerificationResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link AttestationService} interface.
 */
@Slf4j
@Component
public class AttestationServiceImpl implements AttestationService {

  private static final String DIGEST_ALGORITHM = "SHA-256";
  private static final String SIGNATURE_SEPARATOR = ":";

  private final DeviceKeyProvider deviceKeyProvider;
  private final DeviceIdProvider deviceIdProvider;
  private final AttestationPayloadCodec payloadCodec;
  private final String appVersion;

  @Autowired
  public AttestationServiceImpl(DeviceKeyProvider deviceKeyProvider, DeviceIdProvider deviceIdProvider,
      AttestationPayloadCodec payloadCodec, @Value("${idv.attestation.app-version:0.0.0}") String appVersion) {
    this.deviceKeyProvider = deviceKeyProvider;
    this.deviceIdProvider = deviceIdProvider;
    this.payloadCodec = payloadCodec;
    this.appVersion = appVersion;
  }

  @Override
  public CompletableFuture<String> getOrCreateDeviceKey() {
    return deviceKeyProvider.getOrCreateDeviceKey();
  }

  @Override
  public String createSignature(String payload, String key) {
    return HexFormat.of().formatHex(digest(payload, key));
  }

  @Override
  public CompletableFuture<SignedAttestation> createSignedVerification(VerificationResult result) {
    return deviceIdProvider.getDeviceId()
        .thenCompose(deviceId -> deviceKeyProvider.getOrCreateDeviceKey()
            .thenApply(key -> {
              String payload = payloadCodec.encode(result);
              String signature = createSignature(payload, key);
              log.debug("createSignedVerification; signed {} payload for device {}", result.getDocumentType(), deviceId);
              return new SignedAttestation(payload, signature, deviceId, appVersion);
            }));
  }

  @Override
  public VerificationResult decodePayload(String payload) {
    return payloadCodec.decode(payload);
  }

  @Override
  public CompletableFuture<Boolean> verifySignature(SignedAttestation attestation) {
    return deviceKeyProvider.getOrCreateDeviceKey().thenApply(key -> {
      byte[] expected = digest(attestation.getPayload(), key);
      byte[] actual;
      try {
        actual = HexFormat.of().parseHex(attestation.getSignature());
      } catch (IllegalArgumentException ex) {
        log.debug("verifySignature; signature is not hex: {}", ex.getMessage());
        return false;
      }
      return MessageDigest.isEqual(expected, actual);
    });
  }

  private byte[] digest(String payload, String key) {
    try {
      MessageDigest md = MessageDigest.getInstance(DIGEST_ALGORITHM);
      return md.digest((payload + SIGNATURE_SEPARATOR + key).getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      log.error("digest; {} not available", DIGEST_ALGORITHM, ex);
      throw new AttestationException(DIGEST_ALGORITHM + " digest is not available", ex);
    }
  }

}

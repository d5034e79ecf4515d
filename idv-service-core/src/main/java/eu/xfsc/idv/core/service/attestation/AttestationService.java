package eu.xfsc.idv.core.service.attestation;

import java.util.concurrent.CompletableFuture;

import eu.xfsc.idv.core.pojo.SignedAttestation;
import eu.xfsc.idv.core.pojo.VerificationResult;

/**
 * Produces tamper-evident attestations of verification results, signed with a key owned by this device.
 *
 * <p>Storage and cryptographic failures are propagated through the returned futures without retry. A failed
 * future never carries a partial attestation; callers must not submit anything to the remote verifier in that
 * case.</p>
 *
 * @see AttestationServiceImpl
 */
public interface AttestationService {

  /**
   * Returns the device signing key, creating and persisting it on first use.
   *
   * @return the hex encoded key; identical across calls and restarts of the same installation
   */
  CompletableFuture<String> getOrCreateDeviceKey();

  /**
   * Computes the signature of a payload: the lowercase hex SHA-256 digest of {@code payload + ":" + key}.
   *
   * @param payload the base64 payload
   * @param key the device key
   * @return the 64 character hex digest
   */
  String createSignature(String payload, String key);

  /**
   * Serializes, encodes and signs a verification result.
   *
   * @param result the verification result
   * @return the signed attestation; fails if the device id or key cannot be obtained
   */
  CompletableFuture<SignedAttestation> createSignedVerification(VerificationResult result);

  /**
   * Decodes an attestation payload back into the verification result it was created from.
   *
   * @param payload the base64 payload of a {@link SignedAttestation}
   * @return the verification result
   */
  VerificationResult decodePayload(String payload);

  /**
   * Checks an attestation's signature against this device's key.
   *
   * @param attestation the attestation to check
   * @return true if the signature matches the payload
   */
  CompletableFuture<Boolean> verifySignature(SignedAttestation attestation);

}

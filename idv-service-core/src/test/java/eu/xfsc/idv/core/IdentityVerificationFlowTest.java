package eu.xfsc.idv.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import eu.xfsc.idv.core.config.CoreConfig;
import eu.xfsc.idv.core.pojo.FaceMatchResult;
import eu.xfsc.idv.core.pojo.LivenessResult;
import eu.xfsc.idv.core.pojo.NameMatchResult;
import eu.xfsc.idv.core.pojo.SignedAttestation;
import eu.xfsc.idv.core.pojo.VerificationLevel;
import eu.xfsc.idv.core.pojo.VerificationResult;
import eu.xfsc.idv.core.service.attestation.AttestationService;
import eu.xfsc.idv.core.service.matching.NameMatchService;
import eu.xfsc.idv.core.service.securestore.InMemorySecureStore;
import eu.xfsc.idv.core.service.securestore.SecureStore;
import eu.xfsc.idv.core.service.verification.VerificationService;

/**
 * Runs a complete verification attempt through the Spring-wired core:
 * name matching, aggregation and attestation.
 */
@SpringBootTest(classes = CoreConfig.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class IdentityVerificationFlowTest {

  @Autowired
  private NameMatchService nameMatchService;

  @Autowired
  private VerificationService verificationService;

  @Autowired
  private AttestationService attestationService;

  @Autowired
  private SecureStore secureStore;

  @Test
  public void contextShouldUseInMemorySecureStore() {
    assertInstanceOf(InMemorySecureStore.class, secureStore);
  }

  @Test
  public void fullVerificationShouldReachEnhancedLevelAndAttest() {
    NameMatchResult nameMatch = nameMatchService.matchNames("MARIA", "GARCIA-LOPEZ", "Maria Garcia-Lopez");
    FaceMatchResult faceMatch = verificationService.evaluateFaceMatch(0.92, true, true, true);
    LivenessResult liveness = new LivenessResult(true, List.of("blink", "turn_left"), Duration.ofSeconds(4));

    VerificationResult result = verificationService.createVerificationResult(nameMatch, "PASSPORT", "ESP",
        faceMatch, liveness);

    assertTrue(nameMatch.isPassed());
    assertEquals(1.0, nameMatch.getScore(), 1e-9);
    assertTrue(faceMatch.isPassed());
    assertEquals(VerificationLevel.ENHANCED, verificationService.getVerificationLevel(result));
    assertTrue(verificationService.isVerificationPassed(result));
    assertEquals(List.of(), verificationService.getVerificationFailureReasons(result));

    SignedAttestation attestation = attestationService.createSignedVerification(result).join();

    assertEquals("test-device-0001", attestation.getDeviceId());
    assertEquals("1.0.0-test", attestation.getAppVersion());
    assertEquals(result, attestationService.decodePayload(attestation.getPayload()));
    assertTrue(attestationService.verifySignature(attestation).join());
  }

  @Test
  public void deviceKeyShouldBeStoredUnderConfiguredKey() {
    String key = attestationService.getOrCreateDeviceKey().join();

    assertEquals(key, secureStore.get("verification_device_key").join().orElseThrow());
    assertEquals(key, attestationService.getOrCreateDeviceKey().join());
  }
}

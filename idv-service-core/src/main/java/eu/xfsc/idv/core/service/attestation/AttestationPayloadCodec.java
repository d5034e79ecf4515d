package eu.xfsc.idv.core.service.attestation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import eu.xfsc.idv.core.exception.AttestationException;
import eu.xfsc.idv.core.pojo.VerificationResult;

/**
 * Converts a {@link VerificationResult} to and from the attestation payload, which is canonical JSON in standard
 * padded base64. Property order is fixed by the POJOs and time values are written as ISO-8601 strings.
 */
@Component
public class AttestationPayloadCodec {

  private final ObjectMapper mapper = JsonMapper.builder()
      .addModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
      .build();

  /**
   * @param result the verification result
   * @return the base64 payload
   * @throws AttestationException if the result cannot be serialized
   */
  public String encode(VerificationResult result) {
    try {
      String json = mapper.writeValueAsString(result);
      return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    } catch (JsonProcessingException ex) {
      throw new AttestationException("Cannot serialize verification result", ex);
    }
  }

  /**
   * @param payload a base64 payload produced by {@link #encode(VerificationResult)}
   * @return the verification result it encodes
   * @throws AttestationException if the payload is not valid base64 or not a serialized verification result
   */
  public VerificationResult decode(String payload) {
    try {
      byte[] json = Base64.getDecoder().decode(payload);
      return mapper.readValue(json, VerificationResult.class);
    } catch (IllegalArgumentException | IOException ex) {
      throw new AttestationException("Cannot decode attestation payload", ex);
    }
  }

}

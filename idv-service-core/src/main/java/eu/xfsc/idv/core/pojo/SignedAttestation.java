package eu.xfsc.idv.core.pojo;

/**
 * A verification result signed with the device key, ready to be handed to the networking layer.
 */
@lombok.EqualsAndHashCode
@lombok.Getter
@lombok.ToString
@lombok.AllArgsConstructor
public class SignedAttestation {
    /** Base64 encoding of the canonical JSON form of the verification result. */
    private final String payload;
    /** Lowercase hex SHA-256 digest over the payload and the device key. */
    private final String signature;
    private final String deviceId;
    private final String appVersion;
}

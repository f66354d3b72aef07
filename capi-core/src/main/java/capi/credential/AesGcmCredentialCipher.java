package capi.credential;

import capi.util.JsonCodec;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * AES-256-GCM credential cipher.
 *
 * <p>The per-tenant key is {@code HMAC-SHA256(masterKey, "capi-credentials:" + organizationId)},
 * so a blob copied to another tenant's row cannot be opened. Blob layout:
 * {@code base64(iv[12] || ciphertext+tag)}; the plaintext is {@code {"access_token": "..."}}.
 */
public final class AesGcmCredentialCipher implements CredentialCipher {
  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int IV_LENGTH = 12;
  private static final int TAG_LENGTH_BITS = 128;
  private static final String KEY_CONTEXT = "capi-credentials:";

  private final byte[] masterKey;
  private final JsonCodec jsonCodec;
  private final SecureRandom random = new SecureRandom();

  public AesGcmCredentialCipher(byte[] masterKey, JsonCodec jsonCodec) {
    Objects.requireNonNull(masterKey, "masterKey");
    if (masterKey.length < 32) {
      throw new IllegalArgumentException("masterKey must be at least 32 bytes, got: " + masterKey.length);
    }
    this.masterKey = masterKey.clone();
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Creates a cipher from a Base64-encoded master key.
   */
  public static AesGcmCredentialCipher fromBase64(String masterKey, JsonCodec jsonCodec) {
    return new AesGcmCredentialCipher(Base64.getDecoder().decode(masterKey), jsonCodec);
  }

  @Override
  public String decrypt(String blob, String organizationId) {
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(blob);
    } catch (IllegalArgumentException e) {
      throw new CredentialDecryptionException("Credential blob is not valid Base64", e);
    }
    if (decoded.length <= IV_LENGTH) {
      throw new CredentialDecryptionException("Credential blob is too short");
    }
    String json;
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, tenantKey(organizationId),
          new GCMParameterSpec(TAG_LENGTH_BITS, decoded, 0, IV_LENGTH));
      byte[] plain = cipher.doFinal(decoded, IV_LENGTH, decoded.length - IV_LENGTH);
      json = new String(plain, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new CredentialDecryptionException("Failed to decrypt credential for organization " + organizationId, e);
    }
    Map<String, String> fields;
    try {
      fields = jsonCodec.parseStringMap(json);
    } catch (IllegalArgumentException e) {
      throw new CredentialDecryptionException("Decrypted credential is not a JSON object", e);
    }
    String token = fields.get("access_token");
    if (token == null || token.isBlank()) {
      throw new CredentialDecryptionException("Decrypted credential has no access_token");
    }
    return token;
  }

  @Override
  public String encrypt(String accessToken, String organizationId) {
    Objects.requireNonNull(accessToken, "accessToken");
    byte[] iv = new byte[IV_LENGTH];
    random.nextBytes(iv);
    byte[] plain = jsonCodec.toJson(Map.of("access_token", accessToken)).getBytes(StandardCharsets.UTF_8);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, tenantKey(organizationId), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
      byte[] sealed = cipher.doFinal(plain);
      ByteBuffer out = ByteBuffer.allocate(IV_LENGTH + sealed.length);
      out.put(iv).put(sealed);
      return Base64.getEncoder().encodeToString(out.array());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to encrypt credential for organization " + organizationId, e);
    }
  }

  private SecretKeySpec tenantKey(String organizationId) throws GeneralSecurityException {
    Objects.requireNonNull(organizationId, "organizationId");
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(masterKey, "HmacSHA256"));
    byte[] key = mac.doFinal((KEY_CONTEXT + organizationId).getBytes(StandardCharsets.UTF_8));
    return new SecretKeySpec(key, "AES");
  }
}

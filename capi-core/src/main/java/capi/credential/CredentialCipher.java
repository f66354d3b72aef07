package capi.credential;

/**
 * Seals and opens stored access tokens with a key bound to the tenant.
 *
 * @see AesGcmCredentialCipher
 */
public interface CredentialCipher {

    /**
     * Opens an encrypted blob.
     *
     * @param blob           stored ciphertext
     * @param organizationId tenant the blob belongs to
     * @return the access token
     * @throws CredentialDecryptionException if the blob is malformed or was sealed for another tenant
     */
    String decrypt(String blob, String organizationId);

    /**
     * Seals an access token for storage.
     *
     * @param accessToken    token to seal
     * @param organizationId tenant that owns the token
     * @return the blob to store
     */
    String encrypt(String accessToken, String organizationId);
}

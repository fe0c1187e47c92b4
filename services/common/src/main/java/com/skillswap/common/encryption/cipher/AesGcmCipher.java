package com.skillswap.common.encryption.cipher;

import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.spec.AlgorithmParameterSpec;

/**
 * AES in GCM mode with a 96-bit IV and 128-bit tag.
 */
public class AesGcmCipher extends JcaAeadCipher {

    public static final String AES_256_GCM = "AES256GCM";
    public static final String AES_192_GCM = "AES192GCM";
    public static final String AES_128_GCM = "AES128GCM";

    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;

    private final String algorithmTag;
    private final int keyLength;

    private AesGcmCipher(String algorithmTag, int keyLength) {
        this.algorithmTag = algorithmTag;
        this.keyLength = keyLength;
    }

    public static AesGcmCipher aes256() {
        return new AesGcmCipher(AES_256_GCM, 32);
    }

    public static AesGcmCipher aes192() {
        return new AesGcmCipher(AES_192_GCM, 24);
    }

    public static AesGcmCipher aes128() {
        return new AesGcmCipher(AES_128_GCM, 16);
    }

    @Override
    public String algorithmTag() {
        return algorithmTag;
    }

    @Override
    public int keyLength() {
        return keyLength;
    }

    @Override
    public int nonceLength() {
        return GCM_IV_LENGTH;
    }

    @Override
    public int tagLength() {
        return GCM_TAG_LENGTH;
    }

    @Override
    protected String transformation() {
        return "AES/GCM/NoPadding";
    }

    @Override
    protected SecretKey secretKey(byte[] keyBytes) {
        return new SecretKeySpec(keyBytes, "AES");
    }

    @Override
    protected AlgorithmParameterSpec parameterSpec(byte[] nonce) {
        return new GCMParameterSpec(GCM_TAG_LENGTH * 8, nonce);
    }
}

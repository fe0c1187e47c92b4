package com.skillswap.common.encryption.cipher;

import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.spec.AlgorithmParameterSpec;

/**
 * ChaCha20-Poly1305 (RFC 8439) from the JDK provider. Requires 256-bit key material.
 */
public class ChaCha20Poly1305Cipher extends JcaAeadCipher {

    public static final String CHACHA20_POLY1305 = "ChaCha20Poly1305";

    @Override
    public String algorithmTag() {
        return CHACHA20_POLY1305;
    }

    @Override
    public int keyLength() {
        return 32;
    }

    @Override
    public int nonceLength() {
        return 12;
    }

    @Override
    public int tagLength() {
        return 16;
    }

    @Override
    protected String transformation() {
        return "ChaCha20-Poly1305";
    }

    @Override
    protected SecretKey secretKey(byte[] keyBytes) {
        return new SecretKeySpec(keyBytes, "ChaCha20");
    }

    @Override
    protected AlgorithmParameterSpec parameterSpec(byte[] nonce) {
        return new IvParameterSpec(nonce);
    }
}

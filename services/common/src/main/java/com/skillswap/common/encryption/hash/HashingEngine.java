package com.skillswap.common.encryption.hash;

import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import com.skillswap.common.encryption.exception.EncryptionException;
import com.skillswap.common.encryption.model.HashParameters;
import com.skillswap.common.encryption.model.HashRecord;
import com.skillswap.common.encryption.model.HashingAlgorithm;
import com.skillswap.common.encryption.model.HashingOptions;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.generators.BCrypt;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;

/**
 * Salted, optionally peppered, one-way hashing.
 *
 * <p>Argon2id and BCrypt come from BouncyCastle, PBKDF2 and SHA-2 from the JDK. The pepper is appended
 * to the input and only a {@code peppered} flag is recorded, so verification needs the same
 * configured pepper.
 */
@Component
@Slf4j
public class HashingEngine {

    private static final int BCRYPT_SALT_LENGTH = 16;
    private static final int BCRYPT_MAX_INPUT = 72;

    private final HashingAlgorithm defaultAlgorithm;
    private final byte[] pepper;
    private final SecureRandom secureRandom = new SecureRandom();

    public HashingEngine(EncryptionProperties properties) {
        EncryptionProperties.DataEncryption config = properties.getDataEncryption();
        this.defaultAlgorithm = config.getDefaultHashingAlgorithm();
        this.pepper = StringUtils.hasText(config.getDefaultPepper())
            ? config.getDefaultPepper().getBytes(StandardCharsets.UTF_8) : null;
    }

    public HashRecord hash(byte[] data, HashingOptions options, Instant now) {
        if (data == null) {
            throw EncryptionException.invalidInput("Data to hash cannot be null");
        }
        HashingOptions opts = options != null ? options : HashingOptions.defaults();
        HashingAlgorithm algorithm = opts.getAlgorithm() != null ? opts.getAlgorithm() : defaultAlgorithm;
        boolean peppered = opts.isUsePepper() && pepper != null;

        byte[] salt = new byte[algorithm == HashingAlgorithm.BCRYPT ? BCRYPT_SALT_LENGTH : opts.getSaltSize()];
        secureRandom.nextBytes(salt);

        HashParameters parameters = parametersFor(algorithm, opts, peppered);
        byte[] hash = compute(algorithm, withPepper(data, peppered), salt, parameters);

        return HashRecord.builder()
            .hash(Base64.getEncoder().encodeToString(hash))
            .salt(Base64.getEncoder().encodeToString(salt))
            .algorithm(algorithm)
            .parameters(parameters)
            .createdAt(now)
            .build();
    }

    /**
     * Recomputes the hash with the record's salt and parameters and compares in constant time.
     */
    public boolean verify(byte[] data, HashRecord record) {
        if (data == null || record == null || record.getAlgorithm() == null || record.getParameters() == null) {
            return false;
        }
        HashParameters parameters = record.getParameters();
        if (parameters.isPeppered() && pepper == null) {
            log.warn("Hash was peppered but no pepper is configured; verification will fail");
            return false;
        }
        byte[] expected = Base64.getDecoder().decode(record.getHash());
        byte[] salt = Base64.getDecoder().decode(record.getSalt());
        byte[] actual = compute(record.getAlgorithm(), withPepper(data, parameters.isPeppered()), salt, parameters);
        return MessageDigest.isEqual(expected, actual);
    }

    private HashParameters parametersFor(HashingAlgorithm algorithm, HashingOptions opts, boolean peppered) {
        HashParameters.HashParametersBuilder builder = HashParameters.builder()
            .hashSize(opts.getHashSize())
            .peppered(peppered);
        switch (algorithm) {
            case ARGON2ID:
                return builder.timeCost(opts.getTimeCost())
                    .memoryCost(opts.getMemoryCost())
                    .parallelism(opts.getParallelism())
                    .build();
            case BCRYPT:
                return builder.cost(opts.getCost()).hashSize(24).build();
            case PBKDF2:
                return builder.iterations(opts.getIterations()).build();
            case SHA256:
                return builder.hashSize(32).build();
            case SHA512:
                return builder.hashSize(64).build();
            default:
                throw new EncryptionException(EncryptionErrorCode.UNSUPPORTED_ALGORITHM, "Unsupported hashing algorithm: " + algorithm);
        }
    }

    private byte[] compute(HashingAlgorithm algorithm, byte[] input, byte[] salt, HashParameters parameters) {
        switch (algorithm) {
            case ARGON2ID:
                return argon2id(input, salt, parameters);
            case BCRYPT:
                return bcrypt(input, salt, parameters);
            case PBKDF2:
                return pbkdf2(input, salt, parameters);
            case SHA256:
                return digest("SHA-256", input, salt);
            case SHA512:
                return digest("SHA-512", input, salt);
            default:
                throw new EncryptionException(EncryptionErrorCode.UNSUPPORTED_ALGORITHM, "Unsupported hashing algorithm: " + algorithm);
        }
    }

    private byte[] argon2id(byte[] input, byte[] salt, HashParameters parameters) {
        Argon2Parameters argon2 = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
            .withVersion(Argon2Parameters.ARGON2_VERSION_13)
            .withIterations(parameters.getTimeCost())
            .withMemoryAsKB(parameters.getMemoryCost())
            .withParallelism(parameters.getParallelism())
            .withSalt(salt)
            .build();
        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(argon2);
        byte[] out = new byte[parameters.getHashSize()];
        generator.generateBytes(input, out);
        return out;
    }

    private byte[] bcrypt(byte[] input, byte[] salt, HashParameters parameters) {
        // BCrypt only reads the first 72 bytes; longer inputs are pre-hashed so no suffix is ignored
        byte[] password = input.length > BCRYPT_MAX_INPUT ? digest("SHA-256", input, new byte[0]) : input;
        return BCrypt.generate(password, salt, parameters.getCost());
    }

    private byte[] pbkdf2(byte[] input, byte[] salt, HashParameters parameters) {
        char[] password = new String(input, StandardCharsets.UTF_8).toCharArray();
        PBEKeySpec spec = new PBEKeySpec(password, salt, parameters.getIterations(), parameters.getHashSize() * 8);
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new EncryptionException(EncryptionErrorCode.OPERATION_FAILED, "PBKDF2 hashing failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
        }
    }

    private static byte[] digest(String algorithm, byte[] input, byte[] salt) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            digest.update(input);
            digest.update(salt);
            return digest.digest();
        } catch (GeneralSecurityException e) {
            throw new EncryptionException(EncryptionErrorCode.OPERATION_FAILED, algorithm + " hashing failed", e);
        }
    }

    private byte[] withPepper(byte[] data, boolean peppered) {
        if (!peppered) {
            return data;
        }
        byte[] combined = Arrays.copyOf(data, data.length + pepper.length);
        System.arraycopy(pepper, 0, combined, data.length, pepper.length);
        return combined;
    }
}

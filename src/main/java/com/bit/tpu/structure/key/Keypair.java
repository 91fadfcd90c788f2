package com.bit.tpu.structure.key;

import com.bit.tpu.common.Pubkey;
import com.bit.tpu.util.Ed25519Signer;
import lombok.Getter;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Ed25519 签名者：32字节种子 + 派生出的32字节公钥
 */
public class Keypair {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] secretKey;
    @Getter
    private final Pubkey publicKey;

    private Keypair(byte[] secretKey) {
        this.secretKey = secretKey;
        this.publicKey = Pubkey.fromBytes(Ed25519Signer.derivePublicKeyFromPrivateKey(secretKey));
    }

    public static Keypair generate() {
        byte[] seed = new byte[Ed25519Signer.CORE_KEY_LENGTH];
        RANDOM.nextBytes(seed);
        return new Keypair(seed);
    }

    /**
     * 支持32字节种子，或钱包导出的64字节私钥（种子 + 公钥）
     */
    public static Keypair fromSecretKey(byte[] secretKey) {
        if (secretKey.length == Ed25519Signer.CORE_KEY_LENGTH) {
            return new Keypair(secretKey.clone());
        }
        if (secretKey.length == Ed25519Signer.CORE_KEY_LENGTH * 2) {
            Keypair keypair = new Keypair(Arrays.copyOf(secretKey, Ed25519Signer.CORE_KEY_LENGTH));
            byte[] embedded = Arrays.copyOfRange(secretKey, Ed25519Signer.CORE_KEY_LENGTH, secretKey.length);
            if (!Arrays.equals(embedded, keypair.publicKey.toBytes())) {
                throw new IllegalArgumentException("私钥与内嵌公钥不匹配");
            }
            return keypair;
        }
        throw new IllegalArgumentException("私钥必须为32或64字节，实际为" + secretKey.length + "字节");
    }

    public byte[] sign(byte[] data) {
        return Ed25519Signer.sign(secretKey, data);
    }
}

package com.bit.tpu.util;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

/**
 * Ed25519 签名工具：直接调用BouncyCastle底层实现，签名器按线程复用
 */
public class Ed25519Signer {
    // 线程局部缓存签名器和验证器（底层API无状态，可复用）
    private static final ThreadLocal<org.bouncycastle.crypto.signers.Ed25519Signer> SIGNER_THREAD_LOCAL =
            ThreadLocal.withInitial(org.bouncycastle.crypto.signers.Ed25519Signer::new);
    private static final ThreadLocal<org.bouncycastle.crypto.signers.Ed25519Signer> VERIFIER_THREAD_LOCAL =
            ThreadLocal.withInitial(org.bouncycastle.crypto.signers.Ed25519Signer::new);

    // Ed25519核心密钥长度（公钥/私钥均为32字节）
    public static final int CORE_KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    private Ed25519Signer() {}

    /**
     * 签名
     * @param privateKey 32字节私钥（种子）
     * @param data 待签名数据
     * @return 64字节签名
     */
    public static byte[] sign(byte[] privateKey, byte[] data) {
        org.bouncycastle.crypto.signers.Ed25519Signer signer = SIGNER_THREAD_LOCAL.get();
        Ed25519PrivateKeyParameters keyParams = new Ed25519PrivateKeyParameters(privateKey, 0);
        signer.init(true, keyParams);
        signer.update(data, 0, data.length);
        return signer.generateSignature();
    }

    public static boolean verify(byte[] publicKey, byte[] data, byte[] signature) {
        org.bouncycastle.crypto.signers.Ed25519Signer verifier = VERIFIER_THREAD_LOCAL.get();
        Ed25519PublicKeyParameters keyParams = new Ed25519PublicKeyParameters(publicKey, 0);
        verifier.init(false, keyParams);
        verifier.update(data, 0, data.length);
        return verifier.verifySignature(signature);
    }

    /**
     * 从 Ed25519 私钥（32字节）派生公钥（32字节）
     */
    public static byte[] derivePublicKeyFromPrivateKey(byte[] privateKey) {
        if (privateKey.length != CORE_KEY_LENGTH) {
            throw new IllegalArgumentException("私钥必须为32字节");
        }
        Ed25519PrivateKeyParameters privateKeyParams = new Ed25519PrivateKeyParameters(privateKey, 0);
        Ed25519PublicKeyParameters publicKeyParams = privateKeyParams.generatePublicKey();
        return publicKeyParams.getEncoded();
    }
}

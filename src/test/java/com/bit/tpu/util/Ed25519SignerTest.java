package com.bit.tpu.util;

import com.bit.tpu.structure.key.Keypair;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Base58;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class Ed25519SignerTest {

    @Test
    void testSignAndVerify() {
        byte[] seed = new byte[Ed25519Signer.CORE_KEY_LENGTH];
        Arrays.fill(seed, (byte) 1);
        byte[] publicKey = Ed25519Signer.derivePublicKeyFromPrivateKey(seed);
        assertEquals(Ed25519Signer.CORE_KEY_LENGTH, publicKey.length);

        byte[] data = "hello tpu".getBytes(StandardCharsets.UTF_8);
        byte[] signature = Ed25519Signer.sign(seed, data);
        log.info("签名：{}", Base58.encode(signature));
        assertEquals(Ed25519Signer.SIGNATURE_LENGTH, signature.length);
        assertTrue(Ed25519Signer.verify(publicKey, data, signature));

        // Ed25519 签名是确定性的
        assertArrayEquals(signature, Ed25519Signer.sign(seed, data));

        byte[] tampered = data.clone();
        tampered[0] ^= 0x01;
        assertFalse(Ed25519Signer.verify(publicKey, tampered, signature), "数据被篡改后验签应失败");
    }

    @Test
    void testKeypairFromWalletSecretKey() {
        Keypair original = Keypair.generate();
        byte[] seed = new byte[32];
        Arrays.fill(seed, (byte) 9);
        Keypair fromSeed = Keypair.fromSecretKey(seed);

        byte[] walletKey = new byte[64];
        System.arraycopy(seed, 0, walletKey, 0, 32);
        System.arraycopy(fromSeed.getPublicKey().toBytes(), 0, walletKey, 32, 32);
        assertEquals(fromSeed.getPublicKey(), Keypair.fromSecretKey(walletKey).getPublicKey());

        System.arraycopy(original.getPublicKey().toBytes(), 0, walletKey, 32, 32);
        assertThrows(IllegalArgumentException.class, () -> Keypair.fromSecretKey(walletKey), "内嵌公钥不匹配应失败");
        assertThrows(IllegalArgumentException.class, () -> Keypair.fromSecretKey(new byte[16]));
    }
}

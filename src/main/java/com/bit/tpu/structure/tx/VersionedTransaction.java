package com.bit.tpu.structure.tx;

import com.bit.tpu.structure.key.Keypair;

import java.util.ArrayList;
import java.util.List;

/**
 * 版本化交易：消息可以是v0或legacy，通常在构建时即已签名
 */
public class VersionedTransaction extends AbstractTransaction {

    private VersionedTransaction(Message message, List<Signature> signatures) {
        super(message, signatures);
    }

    public static VersionedTransaction fromMessage(Message message) {
        VersionedTransaction transaction = new VersionedTransaction(message, null);
        transaction.resetSignatures();
        return transaction;
    }

    public static VersionedTransaction deserialize(byte[] bytes) {
        WireTransaction wire = WireTransaction.decode(bytes);
        return new VersionedTransaction(wire.getMessage(), new ArrayList<>(wire.getSignatures()));
    }

    /**
     * 追加签名，不清空其他签名者已有的签名
     */
    public void sign(List<Keypair> signers) {
        signMessage(signers);
    }
}

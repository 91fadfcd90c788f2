package com.bit.tpu.structure.tx;

import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.structure.key.Keypair;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * legacy 格式交易：由调用方提供签名者，发送前补齐最近区块哈希并签名
 */
public class LegacyTransaction extends AbstractTransaction {

    /**
     * 持久化nonce，存在时不再获取最近区块哈希
     */
    @Getter
    @Setter
    private NonceInfo nonceInfo;

    private LegacyTransaction(Message message, List<Signature> signatures) {
        super(message, signatures);
    }

    public static LegacyTransaction fromMessage(Message message) {
        if (message.getFormat() != TransactionFormat.LEGACY) {
            throw new TpuException(ErrorType.INVALID_TRANSACTION, "legacy交易只能包含legacy消息");
        }
        LegacyTransaction transaction = new LegacyTransaction(message, null);
        transaction.resetSignatures();
        return transaction;
    }

    public static LegacyTransaction deserialize(byte[] bytes) {
        WireTransaction wire = WireTransaction.decode(bytes);
        if (wire.getFormat() != TransactionFormat.LEGACY) {
            throw new TpuException(ErrorType.INVALID_TRANSACTION, "不是legacy格式交易");
        }
        return new LegacyTransaction(wire.getMessage(), new ArrayList<>(wire.getSignatures()));
    }

    public String getRecentBlockhash() {
        return message.getRecentBlockhash();
    }

    /**
     * 修改区块哈希会使已有签名失效，因此同时清空签名
     */
    public void setRecentBlockhash(String recentBlockhash) {
        message.setRecentBlockhash(recentBlockhash);
        resetSignatures();
    }

    /**
     * 签名：有nonce时以nonce作为区块哈希
     */
    public void sign(List<Keypair> signers) {
        if (nonceInfo != null) {
            message.setRecentBlockhash(nonceInfo.getNonce());
        }
        if (message.getRecentBlockhash() == null) {
            throw new TpuException(ErrorType.INVALID_TRANSACTION, "交易缺少最近区块哈希，无法签名");
        }
        resetSignatures();
        signMessage(signers);
    }
}

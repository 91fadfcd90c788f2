package com.bit.tpu.structure.tx;

import com.bit.tpu.common.Pubkey;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.structure.key.Keypair;
import com.bit.tpu.util.Ed25519Signer;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * legacy / 版本化交易的公共部分：消息 + 与签名账户一一对应的签名槽位
 */
@Getter
public abstract class AbstractTransaction {

    protected Message message;

    /**
     * 签名槽位，长度等于 numRequiredSignatures，未签名的位置为null
     */
    protected List<Signature> signatures;

    protected AbstractTransaction(Message message, List<Signature> signatures) {
        this.message = message;
        this.signatures = signatures;
    }

    protected void resetSignatures() {
        int required = message.getHeader().getNumRequiredSignatures();
        List<Signature> slots = new ArrayList<>(required);
        for (int i = 0; i < required; i++) {
            slots.add(null);
        }
        this.signatures = slots;
    }

    /**
     * 用给定签名者对当前消息签名，签名者必须是消息中的签名账户
     */
    protected void signMessage(List<Keypair> signers) {
        if (signers == null || signers.isEmpty()) {
            throw new TpuException(ErrorType.INVALID_ARGUMENTS, "签名者列表为空");
        }
        if (signatures == null || signatures.size() != message.getHeader().getNumRequiredSignatures()) {
            resetSignatures();
        }
        byte[] messageBytes = message.serialize();
        List<Pubkey> signerKeys = message.signerKeys();
        for (Keypair signer : signers) {
            int index = signerKeys.indexOf(signer.getPublicKey());
            if (index < 0) {
                throw new TpuException(ErrorType.INVALID_ARGUMENTS, "签名者 " + signer.getPublicKey() + " 不是交易的签名账户");
            }
            signatures.set(index, new Signature(signer.sign(messageBytes)));
        }
    }

    public boolean isFullySigned() {
        if (signatures == null || signatures.size() != message.getHeader().getNumRequiredSignatures()) {
            return false;
        }
        for (Signature signature : signatures) {
            if (signature == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * 校验所有签名：对每个签名账户验签
     */
    public boolean verifySignatures() {
        if (!isFullySigned()) {
            return false;
        }
        byte[] messageBytes = message.serialize();
        List<Pubkey> signerKeys = message.signerKeys();
        for (int i = 0; i < signerKeys.size(); i++) {
            if (!Ed25519Signer.verify(signerKeys.get(i).toBytes(), messageBytes, signatures.get(i).getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * 序列化为线格式，所有签名槽位必须已填充
     */
    public byte[] serialize() {
        if (!isFullySigned()) {
            throw new TpuException(ErrorType.INVALID_TRANSACTION, "交易签名不完整，无法序列化");
        }
        return WireTransaction.encode(signatures, message.serialize());
    }

    public List<Signature> getSignatures() {
        return signatures == null ? Collections.emptyList() : Collections.unmodifiableList(signatures);
    }
}

package com.bit.tpu.structure.tx;

import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import lombok.Getter;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.bit.tpu.util.ByteUtils.readCompactU16;
import static com.bit.tpu.util.ByteUtils.writeCompactU16;

/**
 * 已序列化交易的解码视图
 * 线格式：[签名数量(compact-u16)] + [签名(N*64字节)] + [消息]
 * legacy / v0 由消息首字节一次性判定
 */
@Getter
public class WireTransaction {
    // 单笔交易最大大小（IPv6最小MTU 1280 - 40字节IP头 - 8字节分片头）
    public static final int PACKET_DATA_SIZE = 1232;

    private final TransactionFormat format;
    private final List<Signature> signatures;
    private final Message message;
    private final byte[] messageBytes;

    private WireTransaction(List<Signature> signatures, Message message, byte[] messageBytes) {
        this.format = message.getFormat();
        this.signatures = Collections.unmodifiableList(signatures);
        this.message = message;
        this.messageBytes = messageBytes;
    }

    public static WireTransaction decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new TpuException(ErrorType.INVALID_TRANSACTION, "交易字节为空");
        }
        try {
            int[] cursor = {0};
            int signatureCount = readCompactU16(bytes, cursor);
            List<Signature> signatures = new ArrayList<>(signatureCount);
            for (int i = 0; i < signatureCount; i++) {
                signatures.add(Signature.fromBytes(Message.readBytes(bytes, cursor, Signature.LENGTH)));
            }
            int messageStart = cursor[0];
            Message message = Message.deserialize(bytes, cursor);
            if (cursor[0] != bytes.length) {
                throw new IllegalArgumentException("交易末尾存在" + (bytes.length - cursor[0]) + "字节多余数据");
            }
            byte[] messageBytes = new byte[bytes.length - messageStart];
            System.arraycopy(bytes, messageStart, messageBytes, 0, messageBytes.length);
            return new WireTransaction(signatures, message, messageBytes);
        } catch (IllegalArgumentException e) {
            throw new TpuException(ErrorType.INVALID_TRANSACTION, e.getMessage(), e);
        }
    }

    /**
     * 第一个签名即交易ID
     */
    public Signature firstSignature() {
        if (signatures.isEmpty()) {
            throw new TpuException(ErrorType.INVALID_TRANSACTION, "交易没有签名，无法生成交易ID");
        }
        return signatures.get(0);
    }

    static byte[] encode(List<Signature> signatures, byte[] messageBytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(signatures.size() * Signature.LENGTH + messageBytes.length + 3);
        writeCompactU16(out, signatures.size());
        for (Signature signature : signatures) {
            out.writeBytes(signature.getValue());
        }
        out.writeBytes(messageBytes);
        return out.toByteArray();
    }
}

package com.bit.tpu.structure.tx;

import com.bit.tpu.common.Pubkey;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bitcoinj.core.Base58;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.bit.tpu.util.ByteUtils.readCompactU16;
import static com.bit.tpu.util.ByteUtils.writeCompactU16;

/**
 * 交易消息（签名的对象）
 * 格式：[版本前缀(仅v0)] + [消息头(3字节)] + [账户列表] + [最近区块哈希(32字节)] + [指令列表] + [地址查找表(仅v0)]
 * 参考：https://docs.solana.com/developing/programming-model/transactions
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Message {
    public static final int BLOCKHASH_LENGTH = 32;

    private TransactionFormat format = TransactionFormat.LEGACY;

    private MessageHeader header;

    private List<Pubkey> accountKeys;

    /**
     * 最近区块哈希（base58），用于防重放和控制交易有效期
     */
    private String recentBlockhash;

    private List<CompiledInstruction> instructions;

    /**
     * 仅v0消息使用，legacy消息始终为空
     */
    private List<AddressTableLookup> addressTableLookups = new ArrayList<>();

    public static Message legacy(MessageHeader header, List<Pubkey> accountKeys, String recentBlockhash,
                                 List<CompiledInstruction> instructions) {
        return new Message(TransactionFormat.LEGACY, header, accountKeys, recentBlockhash, instructions, new ArrayList<>());
    }

    public static Message v0(MessageHeader header, List<Pubkey> accountKeys, String recentBlockhash,
                             List<CompiledInstruction> instructions, List<AddressTableLookup> addressTableLookups) {
        return new Message(TransactionFormat.V0, header, accountKeys, recentBlockhash, instructions,
                addressTableLookups == null ? new ArrayList<>() : addressTableLookups);
    }

    /**
     * 需要签名的账户（accountKeys 的前 numRequiredSignatures 个）
     */
    public List<Pubkey> signerKeys() {
        return Collections.unmodifiableList(accountKeys.subList(0, header.getNumRequiredSignatures()));
    }

    public byte[] serialize() {
        Objects.requireNonNull(header, "消息头不能为空");
        Objects.requireNonNull(accountKeys, "账户列表不能为空");
        Objects.requireNonNull(recentBlockhash, "最近区块哈希不能为空");
        Objects.requireNonNull(instructions, "指令列表不能为空");

        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        if (format == TransactionFormat.V0) {
            out.write(TransactionFormat.VERSION_PREFIX_MASK);
        }
        out.write(header.getNumRequiredSignatures());
        out.write(header.getNumReadonlySignedAccounts());
        out.write(header.getNumReadonlyUnsignedAccounts());

        writeCompactU16(out, accountKeys.size());
        for (Pubkey key : accountKeys) {
            out.writeBytes(key.toBytes());
        }

        byte[] blockhash = Base58.decode(recentBlockhash);
        if (blockhash.length != BLOCKHASH_LENGTH) {
            throw new IllegalArgumentException("区块哈希必须为32字节，实际为" + blockhash.length + "字节");
        }
        out.writeBytes(blockhash);

        writeCompactU16(out, instructions.size());
        for (CompiledInstruction instruction : instructions) {
            out.write(instruction.getProgramIdIndex());
            writeIndexes(out, instruction.getAccounts());
            byte[] data = instruction.getData() == null ? new byte[0] : instruction.getData();
            writeCompactU16(out, data.length);
            out.writeBytes(data);
        }

        if (format == TransactionFormat.V0) {
            writeCompactU16(out, addressTableLookups.size());
            for (AddressTableLookup lookup : addressTableLookups) {
                out.writeBytes(lookup.getAccountKey().toBytes());
                writeIndexes(out, lookup.getWritableIndexes());
                writeIndexes(out, lookup.getReadonlyIndexes());
            }
        }
        return out.toByteArray();
    }

    /**
     * 从 cursor[0] 处反序列化消息，格式由首字节决定
     */
    public static Message deserialize(byte[] bytes, int[] cursor) {
        int first = readByte(bytes, cursor);
        TransactionFormat format = TransactionFormat.fromMessagePrefix(first);
        int numRequiredSignatures = format == TransactionFormat.LEGACY ? first : readByte(bytes, cursor);
        MessageHeader header = new MessageHeader(numRequiredSignatures, readByte(bytes, cursor), readByte(bytes, cursor));

        int keyCount = readCompactU16(bytes, cursor);
        List<Pubkey> accountKeys = new ArrayList<>(keyCount);
        for (int i = 0; i < keyCount; i++) {
            accountKeys.add(Pubkey.fromBytes(readBytes(bytes, cursor, Pubkey.LENGTH)));
        }
        String recentBlockhash = Base58.encode(readBytes(bytes, cursor, BLOCKHASH_LENGTH));

        int instructionCount = readCompactU16(bytes, cursor);
        List<CompiledInstruction> instructions = new ArrayList<>(instructionCount);
        for (int i = 0; i < instructionCount; i++) {
            int programIdIndex = readByte(bytes, cursor);
            List<Integer> accounts = readIndexes(bytes, cursor);
            int dataLength = readCompactU16(bytes, cursor);
            instructions.add(new CompiledInstruction(programIdIndex, accounts, readBytes(bytes, cursor, dataLength)));
        }

        List<AddressTableLookup> lookups = new ArrayList<>();
        if (format == TransactionFormat.V0) {
            int lookupCount = readCompactU16(bytes, cursor);
            for (int i = 0; i < lookupCount; i++) {
                Pubkey accountKey = Pubkey.fromBytes(readBytes(bytes, cursor, Pubkey.LENGTH));
                lookups.add(new AddressTableLookup(accountKey, readIndexes(bytes, cursor), readIndexes(bytes, cursor)));
            }
        }

        if (numRequiredSignatures > keyCount) {
            throw new IllegalArgumentException("签名账户数量(" + numRequiredSignatures + ")超过账户总数(" + keyCount + ")");
        }
        return new Message(format, header, accountKeys, recentBlockhash, instructions, lookups);
    }

    private static void writeIndexes(ByteArrayOutputStream out, List<Integer> indexes) {
        List<Integer> list = indexes == null ? Collections.emptyList() : indexes;
        writeCompactU16(out, list.size());
        for (int index : list) {
            if (index < 0 || index > 0xFF) {
                throw new IllegalArgumentException("账户索引超出u8范围：" + index);
            }
            out.write(index);
        }
    }

    private static List<Integer> readIndexes(byte[] bytes, int[] cursor) {
        int count = readCompactU16(bytes, cursor);
        List<Integer> indexes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            indexes.add(readByte(bytes, cursor));
        }
        return indexes;
    }

    private static int readByte(byte[] bytes, int[] cursor) {
        if (cursor[0] >= bytes.length) {
            throw new IllegalArgumentException("消息数据被截断，偏移：" + cursor[0]);
        }
        return bytes[cursor[0]++] & 0xFF;
    }

    static byte[] readBytes(byte[] bytes, int[] cursor, int length) {
        if (cursor[0] + length > bytes.length) {
            throw new IllegalArgumentException("数据被截断，需要" + length + "字节，剩余" + (bytes.length - cursor[0]) + "字节");
        }
        byte[] result = new byte[length];
        System.arraycopy(bytes, cursor[0], result, 0, length);
        cursor[0] += length;
        return result;
    }
}

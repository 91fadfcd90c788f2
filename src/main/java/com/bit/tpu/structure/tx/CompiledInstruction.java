package com.bit.tpu.structure.tx;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 编译后的交易指令，程序和账户均以 accountKeys 中的索引表示
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CompiledInstruction {

    /**
     * 程序ID索引（u8）
     * 指向 Message.accountKeys 中程序账户的位置
     */
    private int programIdIndex;

    /**
     * 账户索引列表（u8类型，0-255）
     */
    private List<Integer> accounts;

    /**
     * 指令数据，格式由程序自行定义
     */
    private byte[] data;
}

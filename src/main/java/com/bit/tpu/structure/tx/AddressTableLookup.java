package com.bit.tpu.structure.tx;

import com.bit.tpu.common.Pubkey;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * v0 消息的地址查找表引用
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class AddressTableLookup {
    private Pubkey accountKey;
    private List<Integer> writableIndexes;
    private List<Integer> readonlyIndexes;
}

package com.bit.tpu.rpc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlotUpdate {
    private long slot;
    private SlotUpdateType type;
    private long timestamp;

    /**
     * completed 表示该slot已结束，当前slot视为下一个
     */
    public long observedSlot() {
        return type == SlotUpdateType.COMPLETED ? slot + 1 : slot;
    }
}

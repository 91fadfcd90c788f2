package com.bit.tpu.rpc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * getEpochInfo 返回值，目前只有 slotsInEpoch 参与刷新节奏的计算
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EpochInfo {
    private long epoch;
    private long slotIndex;
    private long slotsInEpoch;
    private long absoluteSlot;
    private long blockHeight;

    public static EpochInfo ofSlotsInEpoch(long slotsInEpoch) {
        EpochInfo epochInfo = new EpochInfo();
        epochInfo.setSlotsInEpoch(slotsInEpoch);
        return epochInfo;
    }
}

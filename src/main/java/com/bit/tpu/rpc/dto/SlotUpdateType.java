package com.bit.tpu.rpc.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * slotsUpdatesSubscribe 推送的更新类型
 */
public enum SlotUpdateType {
    FIRST_SHRED_RECEIVED("firstShredReceived"),
    COMPLETED("completed"),
    CREATED_BANK("createdBank"),
    FROZEN("frozen"),
    DEAD("dead"),
    OPTIMISTIC_CONFIRMATION("optimisticConfirmation"),
    ROOT("root");

    private final String value;

    SlotUpdateType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SlotUpdateType fromValue(String value) {
        for (SlotUpdateType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的slot更新类型：" + value);
    }
}

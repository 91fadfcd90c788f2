package com.bit.tpu.common;

/**
 * RPC 查询的确认级别
 */
public enum Commitment {
    PROCESSED("processed"),
    CONFIRMED("confirmed"),
    FINALIZED("finalized");

    private final String value;

    Commitment(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 兼容旧版本节点的别名：recent/single -> processed，singleGossip -> confirmed，max/root -> finalized
     */
    public static Commitment fromValue(String value) {
        if (value == null) {
            return CONFIRMED;
        }
        switch (value) {
            case "processed":
            case "recent":
            case "single":
                return PROCESSED;
            case "confirmed":
            case "singleGossip":
                return CONFIRMED;
            case "finalized":
            case "max":
            case "root":
                return FINALIZED;
            default:
                throw new IllegalArgumentException("未知的确认级别：" + value);
        }
    }

    /**
     * 当前级别是否已达到目标级别
     */
    public boolean reaches(Commitment target) {
        return this.ordinal() >= target.ordinal();
    }
}

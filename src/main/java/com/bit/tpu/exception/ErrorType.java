package com.bit.tpu.exception;

public enum ErrorType {
    EMPTY_STATE("最近slot窗口为空（尚未记录任何slot）"),
    INVALID_ARGUMENTS("参数无效（交易类型与签名者不匹配）"),
    SEND_FAILED("UDP发送失败（所有TPU地址均发送失败）"),
    NO_LEADER_AVAILABLE("没有可用的领导者TPU地址"),
    RPC_FAILED("RPC调用失败（网络异常/节点返回错误）"),
    INVALID_TRANSACTION("交易格式无效（反序列化/签名缺失）"),
    TRANSACTION_FAILED("交易执行失败（链上返回错误）"),
    CONFIG_INVALID("配置无效（参数缺失/非法）");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}

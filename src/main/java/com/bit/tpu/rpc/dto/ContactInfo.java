package com.bit.tpu.rpc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * getClusterNodes 返回的节点联系信息，tpu为null表示该节点未公开交易接收端口
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContactInfo {
    /**
     * 节点身份公钥（base58）
     */
    private String pubkey;
    private String gossip;
    /**
     * host:port
     */
    private String tpu;
    private String rpc;
    private String version;

    public static ContactInfo of(String pubkey, String tpu) {
        ContactInfo contactInfo = new ContactInfo();
        contactInfo.setPubkey(pubkey);
        contactInfo.setTpu(tpu);
        return contactInfo;
    }
}

package com.bit.tpu.rpc;

import com.bit.tpu.common.Commitment;
import com.bit.tpu.common.Pubkey;
import com.bit.tpu.rpc.dto.Blockhash;
import com.bit.tpu.rpc.dto.ContactInfo;
import com.bit.tpu.rpc.dto.EpochInfo;
import com.bit.tpu.rpc.dto.SignatureStatus;

import java.util.List;

/**
 * 集群查询接口（RPC节点）
 * 所有方法失败时抛出 TpuException(RPC_FAILED)
 */
public interface ClusterQueryClient {

    EpochInfo getEpochInfo(Commitment commitment);

    /**
     * 全量节点列表，包含未公开TPU端口的节点
     */
    List<ContactInfo> getClusterNodes();

    /**
     * 从 startSlot 开始的 limit 个slot的领导者
     */
    List<Pubkey> getSlotLeaders(long startSlot, long limit);

    long getSlot(Commitment commitment);

    Blockhash getLatestBlockhash(Commitment commitment);

    long getBlockHeight(Commitment commitment);

    /**
     * 按传入顺序返回状态，未知的签名对应位置为null
     */
    List<SignatureStatus> getSignatureStatuses(List<String> signatures);
}

package com.bit.tpu.rpc.impl;

import com.bit.tpu.common.Commitment;
import com.bit.tpu.common.Pubkey;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.rpc.ClusterQueryClient;
import com.bit.tpu.rpc.dto.Blockhash;
import com.bit.tpu.rpc.dto.ContactInfo;
import com.bit.tpu.rpc.dto.EpochInfo;
import com.bit.tpu.rpc.dto.SignatureStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 HTTP JSON-RPC 的集群查询实现
 * 超时由 RestTemplate 的请求工厂控制，本类不做重试
 */
@Slf4j
public class JsonRpcClusterClient implements ClusterQueryClient {

    private final String rpcUrl;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestId = new AtomicLong();

    public JsonRpcClusterClient(String rpcUrl, int timeoutMs) {
        this(rpcUrl, buildRestTemplate(timeoutMs), new ObjectMapper());
    }

    public JsonRpcClusterClient(String rpcUrl, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.rpcUrl = rpcUrl;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public EpochInfo getEpochInfo(Commitment commitment) {
        JsonNode result = call("getEpochInfo", commitmentConfig(commitment));
        return convert(result, EpochInfo.class, "getEpochInfo");
    }

    @Override
    public List<ContactInfo> getClusterNodes() {
        JsonNode result = call("getClusterNodes");
        List<ContactInfo> nodes = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            nodes.add(convert(node, ContactInfo.class, "getClusterNodes"));
        }
        return nodes;
    }

    @Override
    public List<Pubkey> getSlotLeaders(long startSlot, long limit) {
        JsonNode result = call("getSlotLeaders", startSlot, limit);
        if (!result.isArray()) {
            throw new TpuException(ErrorType.RPC_FAILED, "getSlotLeaders 返回格式错误：" + result);
        }
        List<Pubkey> leaders = new ArrayList<>(result.size());
        for (JsonNode leader : result) {
            if (!leader.isTextual()) {
                throw new TpuException(ErrorType.RPC_FAILED, "getSlotLeaders 返回了无效的公钥：" + leader);
            }
            try {
                leaders.add(Pubkey.fromBase58(leader.textValue()));
            } catch (IllegalArgumentException e) {
                throw new TpuException(ErrorType.RPC_FAILED, "getSlotLeaders 返回了无效的公钥：" + leader, e);
            }
        }
        return leaders;
    }

    @Override
    public long getSlot(Commitment commitment) {
        return asLong(call("getSlot", commitmentConfig(commitment)), "getSlot");
    }

    @Override
    public Blockhash getLatestBlockhash(Commitment commitment) {
        JsonNode result = call("getLatestBlockhash", commitmentConfig(commitment));
        return convert(result.path("value"), Blockhash.class, "getLatestBlockhash");
    }

    @Override
    public long getBlockHeight(Commitment commitment) {
        return asLong(call("getBlockHeight", commitmentConfig(commitment)), "getBlockHeight");
    }

    @Override
    public List<SignatureStatus> getSignatureStatuses(List<String> signatures) {
        JsonNode result = call("getSignatureStatuses", signatures, Map.of("searchTransactionHistory", false));
        List<SignatureStatus> statuses = new ArrayList<>(signatures.size());
        for (JsonNode status : result.path("value")) {
            statuses.add(status.isNull() ? null : convert(status, SignatureStatus.class, "getSignatureStatuses"));
        }
        return statuses;
    }

    private static Map<String, String> commitmentConfig(Commitment commitment) {
        return Map.of("commitment", commitment.getValue());
    }

    /**
     * 发起一次 JSON-RPC 调用，返回 result 节点
     */
    JsonNode call(String method, Object... params) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", requestId.incrementAndGet());
        body.put("method", method);
        ArrayNode paramsNode = body.putArray("params");
        for (Object param : params) {
            paramsNode.add(objectMapper.valueToTree(param));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String response;
        try {
            response = restTemplate.postForObject(rpcUrl, new HttpEntity<>(body.toString(), headers), String.class);
        } catch (RestClientException e) {
            throw new TpuException(ErrorType.RPC_FAILED, method + " 请求失败：" + e.getMessage(), e);
        }
        if (response == null) {
            throw new TpuException(ErrorType.RPC_FAILED, method + " 返回为空");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new TpuException(ErrorType.RPC_FAILED, method + " 返回无法解析", e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new TpuException(ErrorType.RPC_FAILED,
                    method + " 返回错误 " + error.path("code").asInt() + "：" + error.path("message").asText());
        }
        JsonNode result = root.get("result");
        if (result == null) {
            throw new TpuException(ErrorType.RPC_FAILED, method + " 返回缺少result字段");
        }
        log.trace("{} -> {}", method, result);
        return result;
    }

    /**
     * result 必须是非负整数，asLong() 对 null 或字符串会静默返回0
     */
    private static long asLong(JsonNode result, String method) {
        if (!result.isIntegralNumber() || !result.canConvertToLong() || result.longValue() < 0) {
            throw new TpuException(ErrorType.RPC_FAILED, method + " 返回的不是非负整数：" + result);
        }
        return result.longValue();
    }

    private <T> T convert(JsonNode node, Class<T> type, String method) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new TpuException(ErrorType.RPC_FAILED, method + " 返回格式错误", e);
        }
    }
}

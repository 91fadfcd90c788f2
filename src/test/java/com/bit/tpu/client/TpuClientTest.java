package com.bit.tpu.client;

import com.bit.tpu.common.Pubkey;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.leader.LeaderTpuServiceFixtures;
import com.bit.tpu.rpc.FakeClusterQueryClient;
import com.bit.tpu.rpc.dto.ContactInfo;
import com.bit.tpu.structure.key.Keypair;
import com.bit.tpu.structure.tx.LegacyTransaction;
import com.bit.tpu.structure.tx.TestTransactions;
import com.bit.tpu.structure.tx.TransactionFormat;
import com.bit.tpu.structure.tx.VersionedTransaction;
import com.bit.tpu.structure.tx.WireTransaction;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class TpuClientTest {

    private DatagramSocket leaderSocket;
    private Pubkey leader;
    private FakeClusterQueryClient client;
    private TpuClient tpuClient;

    @BeforeEach
    void setUp() throws Exception {
        leaderSocket = new DatagramSocket(0, InetAddress.getLoopbackAddress());
        leaderSocket.setSoTimeout(5000);
        leader = Keypair.generate().getPublicKey();
        client = new FakeClusterQueryClient(leader);
        client.nodes.add(ContactInfo.of(leader.toBase58(), "127.0.0.1:" + leaderSocket.getLocalPort()));
        tpuClient = TpuClient.load(client, null, TpuClientConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        tpuClient.close();
        leaderSocket.close();
    }

    private byte[] receive() throws Exception {
        DatagramPacket packet = new DatagramPacket(new byte[2048], 2048);
        leaderSocket.receive(packet);
        return Arrays.copyOf(packet.getData(), packet.getLength());
    }

    @Test
    void testSendRawTransaction() throws Exception {
        byte[] raw = TestTransactions.signedLegacy(Keypair.generate());
        String expected = WireTransaction.decode(raw).firstSignature().toBase58();

        String signature = tpuClient.sendRawTransaction(raw).get(5, TimeUnit.SECONDS);
        assertEquals(expected, signature, "返回值应为第一个签名的base58");
        assertArrayEquals(raw, receive(), "领导者应收到原始交易字节");
        log.info("交易已送达领导者：{}", signature);
    }

    @Test
    void testSendVersionedTransaction() throws Exception {
        VersionedTransaction transaction = TestTransactions.signedV0(Keypair.generate());

        String signature = tpuClient.sendTransaction(transaction).get(5, TimeUnit.SECONDS);
        assertEquals(transaction.getSignatures().get(0).toBase58(), signature);
        assertEquals(TransactionFormat.V0, WireTransaction.decode(receive()).getFormat());
    }

    @Test
    void testSendLegacyTransactionFetchesBlockhash() throws Exception {
        Keypair payer = Keypair.generate();
        LegacyTransaction transaction = LegacyTransaction.fromMessage(
                TestTransactions.transferMessage(TransactionFormat.LEGACY, payer, null));

        String signature = tpuClient.sendTransaction(transaction, List.of(payer)).get(5, TimeUnit.SECONDS);
        assertEquals(1, client.latestBlockhashCalls.get());

        WireTransaction received = WireTransaction.decode(receive());
        assertEquals(client.blockhash, received.getMessage().getRecentBlockhash());
        assertEquals(signature, received.firstSignature().toBase58());
    }

    @Test
    void testVersionedTransactionWithSignersRejected() {
        VersionedTransaction transaction = TestTransactions.signedV0(Keypair.generate());
        CompletableFuture<String> future = tpuClient.sendTransaction(transaction, List.of(Keypair.generate()));
        assertInvalidArguments(future);
    }

    @Test
    void testLegacyTransactionWithoutSignersRejected() {
        LegacyTransaction transaction = LegacyTransaction.fromMessage(
                TestTransactions.transferMessage(TransactionFormat.LEGACY, Keypair.generate(), null));
        assertInvalidArguments(tpuClient.sendTransaction(transaction, null));
        assertInvalidArguments(tpuClient.sendTransaction(transaction, List.of()));
        assertEquals(0, client.latestBlockhashCalls.get(), "参数错误时不应发起任何RPC请求");
    }

    private static void assertInvalidArguments(CompletableFuture<String> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        TpuException cause = assertInstanceOf(TpuException.class, e.getCause());
        assertEquals(ErrorType.INVALID_ARGUMENTS, cause.getErrorType());
    }

    @Test
    void testNoLeaderAvailable() {
        client.nodes.clear();
        TpuClient noLeaderClient = TpuClient.load(client, null, TpuClientConfig.defaults());
        try {
            CompletableFuture<String> future = noLeaderClient.sendRawTransaction(TestTransactions.signedLegacy(Keypair.generate()));
            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertEquals(ErrorType.NO_LEADER_AVAILABLE, ((TpuException) e.getCause()).getErrorType());
        } finally {
            noLeaderClient.close();
        }
    }

    @Test
    void testPartialSendFailureStillSucceeds() throws Exception {
        Pubkey unreachable = Keypair.generate().getPublicKey();
        client.leaderBySlot.put(client.slot + 1, unreachable);
        Map<Pubkey, InetSocketAddress> leaderTpuMap = new HashMap<>();
        leaderTpuMap.put(leader, new InetSocketAddress(InetAddress.getLoopbackAddress(), leaderSocket.getLocalPort()));
        // 端口0无法发送
        leaderTpuMap.put(unreachable, new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));

        TpuClient partialClient = TpuClient.create(client,
                LeaderTpuServiceFixtures.withLeaderTpuMap(client, leaderTpuMap), TpuClientConfig.defaults());
        try {
            assertEquals(2, partialClient.getLeaderTpuService().leaderTpuSockets(partialClient.getFanoutSlots()).size());
            byte[] raw = TestTransactions.signedLegacy(Keypair.generate());

            String signature = partialClient.sendRawTransaction(raw).get(5, TimeUnit.SECONDS);
            assertEquals(WireTransaction.decode(raw).firstSignature().toBase58(), signature, "任一地址发送成功即整体成功");
            assertArrayEquals(raw, receive());
        } finally {
            partialClient.close();
        }
    }

    @Test
    void testAllSendsFailedCarriesEveryCause() throws Exception {
        Pubkey second = Keypair.generate().getPublicKey();
        client.leaderBySlot.put(client.slot + 1, second);
        Map<Pubkey, InetSocketAddress> leaderTpuMap = new HashMap<>();
        leaderTpuMap.put(leader, new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        leaderTpuMap.put(second, InetSocketAddress.createUnresolved("tpu.invalid", 8003));

        TpuClient failingClient = TpuClient.create(client,
                LeaderTpuServiceFixtures.withLeaderTpuMap(client, leaderTpuMap), TpuClientConfig.defaults());
        try {
            CompletableFuture<String> future = failingClient.sendRawTransaction(TestTransactions.signedLegacy(Keypair.generate()));
            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            TpuException cause = assertInstanceOf(TpuException.class, e.getCause());
            assertEquals(ErrorType.SEND_FAILED, cause.getErrorType());
            assertEquals(2, cause.getSuppressed().length, "每个失败的地址对应一个原因");
            log.info("全部发送失败：{}", cause.getMessage());
        } finally {
            failingClient.close();
        }
    }

    @Test
    void testInvalidTransactionRejectedBeforeSend() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> tpuClient.sendRawTransaction(new byte[]{1, 2, 3}).get(5, TimeUnit.SECONDS));
        assertEquals(ErrorType.INVALID_TRANSACTION, ((TpuException) e.getCause()).getErrorType());

        byte[] oversized = new byte[WireTransaction.PACKET_DATA_SIZE + 1];
        e = assertThrows(ExecutionException.class, () -> tpuClient.sendRawTransaction(oversized).get(5, TimeUnit.SECONDS));
        assertEquals(ErrorType.INVALID_TRANSACTION, ((TpuException) e.getCause()).getErrorType());
    }

    @Test
    void testFanoutSlotsClamped() {
        assertEquals(12, tpuClient.getFanoutSlots());
        assertEquals(100, TpuClientConfig.builder().fanoutSlots(500).build().clampedFanoutSlots());
        assertEquals(1, TpuClientConfig.builder().fanoutSlots(0).build().clampedFanoutSlots());
        assertEquals(1, TpuClientConfig.builder().fanoutSlots(-3).build().clampedFanoutSlots());
        assertEquals(37, TpuClientConfig.builder().fanoutSlots(37).build().clampedFanoutSlots());
    }

    @Test
    void testSendAfterCloseFails() {
        tpuClient.close();
        assertTrue(tpuClient.getLeaderTpuService().isClosed(), "关闭客户端应同时停止领导者服务");
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> tpuClient.sendRawTransaction(TestTransactions.signedLegacy(Keypair.generate())).get(5, TimeUnit.SECONDS));
        assertEquals(ErrorType.SEND_FAILED, ((TpuException) e.getCause()).getErrorType());
    }
}

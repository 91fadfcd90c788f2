package com.bit.tpu.api;

import com.bit.tpu.api.dto.SendRawRequest;
import com.bit.tpu.result.Result;
import com.bit.tpu.service.TxService;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Slf4j
public class TxApiTest {

    private final AtomicReference<SendRawRequest> lastRequest = new AtomicReference<>();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TxService txService = request -> {
            lastRequest.set(request);
            return Result.OK("交易已发送", "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW");
        };
        TxApi txApi = new TxApi();
        ReflectionTestUtils.setField(txApi, "txService", txService);
        mockMvc = MockMvcBuilders.standaloneSetup(txApi).build();
    }

    @Test
    void testSendRaw() throws Exception {
        mockMvc.perform(post("/tx/sendRaw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transaction\":\"4hXTCkRzt9WyecNzV1XPgCDfGAZzQKNxLXgynz5QDuWWPSAZBZSHptvWRL3BjCvzUXRdKvHL2b7yGrRQcWyaqsaBCncVG7BFggS8w9snUts67BSh3EqKpXLUm5UMHfD7ZBe9GhARjbNQMLJ1QD3Spr6oMTBU6EhdB4RD8CP2xUxr2u3d6fos36PD98XS6oX8TQjLpsMwncs5DAMiD4nNnR8NBfyghGCWvCVifVwvA8B8TJxE1aiyiv2L429BCWfyzAme5sZW8rDb14NeCQHhZbtNqfXhcp2tAnaAT\",\"encoding\":\"base58\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.code").value(200));

        assertEquals("base58", lastRequest.get().getEncoding());
        assertTrue(lastRequest.get().getTransaction().startsWith("4hXTCk"));
    }

    @Test
    void testEncodingDefaultsToBase58() throws Exception {
        mockMvc.perform(post("/tx/sendRaw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transaction\":\"abc\"}"))
                .andExpect(status().isOk());
        assertEquals("base58", lastRequest.get().getEncoding());
    }
}

package com.bit.tpu.api;

import com.bit.tpu.api.dto.SendRawRequest;
import com.bit.tpu.result.Result;
import com.bit.tpu.service.TxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/tx")
public class TxApi {

    @Autowired
    private TxService txService;


    /**
     * 通过Http提交一笔已签名交易，由TPU直发给领导者
     * @param request
     * @return 交易签名
     */
    @PostMapping("/sendRaw")
    public Result<String> sendRawTx(@RequestBody SendRawRequest request) {
        return txService.sendRawTx(request);
    }

}

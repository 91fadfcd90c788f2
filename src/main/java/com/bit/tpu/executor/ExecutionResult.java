package com.bit.tpu.executor;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ExecutionResult {
    private boolean confirmed;
    private String signature;
    private String error;

    public static ExecutionResult confirmed(String signature) {
        return new ExecutionResult(true, signature, null);
    }

    public static ExecutionResult unconfirmed(String signature, String error) {
        return new ExecutionResult(false, signature, error);
    }
}

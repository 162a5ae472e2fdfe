package com.intellilend.liquidation.dto;

public record TxResult(String transactionHash, boolean success, String error) {

    public static TxResult ok(String transactionHash) {
        return new TxResult(transactionHash, true, null);
    }

    public static TxResult failed(String transactionHash, String error) {
        return new TxResult(transactionHash, false, error);
    }
}

package com.intellilend.liquidation.dto;

public record AuctionStartResult(String auctionId, TxResult tx) {
}

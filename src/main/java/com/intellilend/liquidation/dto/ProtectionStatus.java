package com.intellilend.liquidation.dto;

public record ProtectionStatus(boolean active, ProtectionDetails details) {
}

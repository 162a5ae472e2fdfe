package com.intellilend.liquidation.common.exception;

import com.intellilend.liquidation.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        }
        String errorCode = r.getErrorCode();
        if (errorCode == null) {
            return ResponseEntity.badRequest().body(new ErrorResponse(null, r.getError(), r.getTimestamp()));
        }
        return ResponseEntity.status(statusOf(errorCode)).body(new ErrorResponse(errorCode, r.getError(), r.getTimestamp()));
    }

    static HttpStatus statusOf(String errorCode) {
        return switch (errorCode) {
            case "ERR-VAL-001", "ERR-VAL-002", "ERR-REQ-001" -> HttpStatus.BAD_REQUEST;
            case "ERR-LEDGER-001", "ERR-LEDGER-CIRCUIT-OPEN" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ERR-LEDGER-REVERT" -> HttpStatus.CONFLICT;
            case "ERR-LEDGER-TIMEOUT" -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private record ErrorResponse(String code, String message, Instant timestamp) {
    }
}

package com.intellilend.liquidation.service.ledger;

import com.intellilend.liquidation.dto.AuctionStartResult;
import com.intellilend.liquidation.dto.LiquidationHistoryEntry;
import com.intellilend.liquidation.dto.ProtectionDetails;
import com.intellilend.liquidation.dto.TxResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Boundary to the external lending ledger and its auxiliary auction/protection contracts.
 * <p>
 * Calls block the calling thread. Implementations signal failure with
 * {@link com.intellilend.liquidation.common.exception.LedgerException} (transport, timeout),
 * {@link com.intellilend.liquidation.common.exception.ContractRevertException} (contract rejected the call)
 * or {@link com.intellilend.liquidation.common.exception.ValidationException} (malformed amounts).
 */
public interface LedgerGateway {

    BigDecimal getDebt(String borrower);

    BigDecimal getCollateral(String borrower);

    List<String> listActiveBorrowers();

    boolean hasActiveProtection(String borrower);

    Optional<ProtectionDetails> getProtectionDetails(String borrower);

    TxResult activateProtection(String borrower);

    AuctionStartResult startAuction(String borrower,
                                    BigDecimal collateralAmount,
                                    BigDecimal startPrice,
                                    BigDecimal reservePrice,
                                    long durationSec);

    TxResult liquidate(String borrower);

    List<LiquidationHistoryEntry> getLiquidationHistory(String borrower);
}

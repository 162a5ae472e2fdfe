package com.intellilend.liquidation.common.constants;

import java.math.BigDecimal;

/**
 * LiquidationConsts: fixed remediation parameters that are not operator-tunable.
 */
public interface LiquidationConsts {

    interface Auction {
        /** Start price as a multiple of the collateral value. */
        BigDecimal START_PRICE_FACTOR = new BigDecimal("1.20");
        /** Reserve price as a multiple of the collateral value. */
        BigDecimal RESERVE_PRICE_FACTOR = new BigDecimal("0.70");
    }

    interface Ratio {
        /** Scale used when dividing collateral by debt. */
        int SCALE = 18;
    }

    interface Audit {
        String SOURCE = "liquidation-engine";
    }
}

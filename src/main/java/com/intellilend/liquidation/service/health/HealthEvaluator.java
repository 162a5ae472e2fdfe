package com.intellilend.liquidation.service.health;

import com.intellilend.liquidation.common.constants.LiquidationConsts;
import com.intellilend.liquidation.common.exception.ValidationException;
import com.intellilend.liquidation.dto.HealthClassification;
import com.intellilend.liquidation.dto.Thresholds;
import com.intellilend.liquidation.enums.HealthState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure mapping of (debt, collateral, thresholds) to a health classification. No I/O, no state.
 * <p>
 * ratio = collateral / debt; Liquidatable below the liquidation threshold, AtRisk below the
 * warning threshold, Healthy otherwise. Zero debt is always Healthy with an infinite ratio.
 */
@Component
public class HealthEvaluator {

    public HealthClassification classify(BigDecimal debt, BigDecimal collateral, Thresholds thresholds) {
        requireAmount(debt, "debt");
        requireAmount(collateral, "collateral");
        requireThresholds(thresholds);

        if (debt.signum() == 0) {
            return new HealthClassification(Double.POSITIVE_INFINITY, HealthState.HEALTHY);
        }

        BigDecimal ratio = collateral.divide(debt, LiquidationConsts.Ratio.SCALE, RoundingMode.HALF_UP);
        HealthState state;
        if (ratio.compareTo(thresholds.liquidationThreshold()) < 0) {
            state = HealthState.LIQUIDATABLE;
        } else if (ratio.compareTo(thresholds.warningThreshold()) < 0) {
            state = HealthState.AT_RISK;
        } else {
            state = HealthState.HEALTHY;
        }
        return new HealthClassification(ratio.doubleValue(), state);
    }

    private static void requireAmount(BigDecimal v, String name) {
        if (v == null) throw new ValidationException(name + " is null");
        if (v.signum() < 0) throw new ValidationException(name + " is negative: " + v.toPlainString());
    }

    private static void requireThresholds(Thresholds t) {
        if (t == null || t.liquidationThreshold() == null || t.warningThreshold() == null) {
            throw new ValidationException("thresholds are not set");
        }
    }
}

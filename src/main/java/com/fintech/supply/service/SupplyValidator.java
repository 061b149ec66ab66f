package com.fintech.supply.service;

import com.fintech.supply.dto.LayerOneSupply;
import com.fintech.supply.dto.LayerTwoSupply;
import com.fintech.supply.dto.ReconciledSupply;
import com.fintech.supply.dto.ValidationResult;
import com.fintech.supply.util.SupplyUnits;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks raw supply facts and reconciled results against the supply invariants.
 * <p>
 * Errors abort a reconciliation and are never retried: refetching does not
 * repair bad upstream data. Warnings flag unusual but possible states.
 */
@Component
public class SupplyValidator {

    /**
     * Relative tolerance for "a equals b + c" supply relationships (0.1%).
     */
    static final BigDecimal RELATIONSHIP_TOLERANCE = new BigDecimal("0.001");

    /**
     * The reconciled total should keep at least this share of the layer one total.
     */
    static final BigDecimal MIN_LAYER_ONE_SHARE = new BigDecimal("0.99");

    public ValidationResult validateLayerOne(LayerOneSupply supply) {
        ValidationResult result = new ValidationResult();

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("totalSupply", supply.getTotalSupply());
        fields.put("lockedSupply", supply.getLockedSupply());
        fields.put("lockedSupplyGenesis", supply.getLockedSupplyGenesis());
        fields.put("liquidSupply", supply.getLiquidSupply());
        fields.put("circulatingSupply", supply.getCirculatingSupply());

        Map<String, BigDecimal> amounts = parseAmounts("L1", fields, result);
        if (!result.isValid()) {
            return result;
        }

        amounts.forEach((field, amount) -> {
            if (amount.signum() == 0) {
                result.addWarning(String.format("L1 %s is zero", field));
            }
        });

        BigDecimal totalSupply = amounts.get("totalSupply");
        BigDecimal lockedSupply = amounts.get("lockedSupply");
        BigDecimal liquidSupply = amounts.get("liquidSupply");
        BigDecimal circulatingSupply = amounts.get("circulatingSupply");

        BigDecimal calculatedTotal = lockedSupply.add(liquidSupply);
        if (SupplyUnits.exceedsTolerance(totalSupply, calculatedTotal, totalSupply, RELATIONSHIP_TOLERANCE)) {
            result.addWarning(String.format(
                    "L1 supply relationship inconsistency: totalSupply (%s) != lockedSupply + liquidSupply (%s)",
                    totalSupply.toPlainString(), calculatedTotal.toPlainString()));
        }

        if (circulatingSupply.compareTo(totalSupply) > 0) {
            result.addError(String.format("L1 circulatingSupply (%s) cannot exceed totalSupply (%s)",
                    circulatingSupply.toPlainString(), totalSupply.toPlainString()));
        }

        return result;
    }

    public ValidationResult validateLayerTwo(LayerTwoSupply supply) {
        ValidationResult result = new ValidationResult();

        if (isBlank(supply.getTotalSupply()) || isBlank(supply.getTotalDepositedConfirmed())) {
            result.addError("L2 data is incomplete: missing totalSupply or totalDepositedConfirmed");
            return result;
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("totalSupply", supply.getTotalSupply());
        fields.put("totalDepositedConfirmed", supply.getTotalDepositedConfirmed());
        fields.put("totalWithdrawn", supply.getTotalWithdrawn());

        Map<String, BigDecimal> amounts = parseAmounts("L2", fields, result);
        if (!result.isValid()) {
            return result;
        }

        BigDecimal totalSupply = amounts.get("totalSupply");
        BigDecimal deposited = amounts.get("totalDepositedConfirmed");
        BigDecimal withdrawn = amounts.get("totalWithdrawn");

        if (deposited.compareTo(totalSupply) > 0) {
            result.addError(String.format("L2 totalDepositedConfirmed (%s) cannot exceed totalSupply (%s)",
                    deposited.toPlainString(), totalSupply.toPlainString()));
        }

        BigDecimal expectedNetSupply = totalSupply.subtract(deposited.subtract(withdrawn));
        BigDecimal storedNetSupply = parseOrNull(supply.getNetSupply());
        if (storedNetSupply == null || storedNetSupply.compareTo(expectedNetSupply) != 0) {
            result.addWarning(String.format("L2 netSupply (%s) doesn't match calculated value (%s)",
                    supply.getNetSupply(), expectedNetSupply.toPlainString()));
        }

        if (expectedNetSupply.signum() < 0) {
            result.addWarning(String.format(
                    "L2 net supply is negative (%s) - more deposited than total supply",
                    expectedNetSupply.toPlainString()));
        }

        return result;
    }

    /**
     * @param supply reconciled figures, in whole tokens
     * @param layerOne the layer one facts the figures were derived from
     * @param layerTwo the layer two facts the figures were derived from
     */
    public ValidationResult validateReconciled(ReconciledSupply supply, LayerOneSupply layerOne,
                                               LayerTwoSupply layerTwo) {
        ValidationResult result = new ValidationResult();

        BigDecimal totalSupply = supply.getTotalSupply();
        BigDecimal circulatingSupply = supply.getCirculatingSupply();

        if (totalSupply.signum() <= 0) {
            result.addError("Reconciled totalSupply must be positive");
        }
        if (circulatingSupply.signum() < 0) {
            result.addError("Reconciled circulatingSupply cannot be negative");
        }
        if (circulatingSupply.compareTo(totalSupply) > 0) {
            result.addError(String.format("Reconciled circulatingSupply (%s) cannot exceed totalSupply (%s)",
                    circulatingSupply.toPlainString(), totalSupply.toPlainString()));
        }

        try {
            BigDecimal layerOneTotal = SupplyUnits.fromWei(layerOne.getTotalSupply());
            if (totalSupply.compareTo(layerOneTotal.multiply(MIN_LAYER_ONE_SHARE)) < 0) {
                result.addWarning(String.format(
                        "Reconciled totalSupply (%s) appears lower than expected based on L1 totalSupply (%s), L2 netSupply %s",
                        totalSupply.toPlainString(), layerOneTotal.toPlainString(), layerTwo.getNetSupply()));
            }
        } catch (NumberFormatException e) {
            result.addError("Reconciliation validation error: " + e.getMessage());
        }

        BigDecimal supplySum = supply.getLockedSupply().add(supply.getLiquidSupply());
        if (SupplyUnits.exceedsTolerance(totalSupply, supplySum, totalSupply, RELATIONSHIP_TOLERANCE)) {
            result.addWarning(String.format(
                    "Reconciled supply relationship inconsistency: totalSupply (%s) != lockedSupply + liquidSupply (%s)",
                    totalSupply.toPlainString(), supplySum.toPlainString()));
        }

        return result;
    }

    private Map<String, BigDecimal> parseAmounts(String layer, Map<String, String> fields, ValidationResult result) {
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        fields.forEach((field, value) -> {
            if (isBlank(value)) {
                result.addError(String.format("%s %s is missing", layer, field));
                return;
            }
            try {
                BigDecimal amount = SupplyUnits.parseWei(value);
                if (SupplyUnits.isNegative(amount)) {
                    result.addError(String.format("%s %s cannot be negative: %s", layer, field, value));
                }
                amounts.put(field, amount);
            } catch (NumberFormatException e) {
                result.addError(String.format("%s validation error: %s is not an integer amount (%s)",
                        layer, field, value));
            }
        });
        return amounts;
    }

    private static BigDecimal parseOrNull(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return SupplyUnits.parseWei(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

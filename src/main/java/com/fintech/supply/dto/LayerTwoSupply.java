package com.fintech.supply.dto;

import com.fintech.supply.util.SupplyUnits;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Supply facts reported by the layer two network subgraph.
 * <p>
 * {@code netSupply} is always derived here and can never be supplied by a
 * caller, so {@code netSupply == totalSupply - (totalDepositedConfirmed - totalWithdrawn)}
 * holds for every instance built from parseable amounts.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LayerTwoSupply {

    String totalSupply;

    /**
     * Tokens deposited from layer one through the bridge and confirmed on layer two.
     */
    String totalDepositedConfirmed;

    /**
     * Tokens burned on layer two when a withdrawal to layer one was initiated.
     */
    String totalWithdrawn;

    /**
     * Tokens minted on layer two net of bridge flow. May be negative.
     * {@code null} when a required amount is missing or unparseable.
     */
    String netSupply;

    /**
     * Builds a snapshot and derives its net supply. A missing withdrawal
     * amount counts as zero.
     */
    public static LayerTwoSupply of(String totalSupply, String totalDepositedConfirmed, String totalWithdrawn) {
        String withdrawn = totalWithdrawn == null || totalWithdrawn.isBlank() ? "0" : totalWithdrawn;
        return new LayerTwoSupply(totalSupply, totalDepositedConfirmed, withdrawn,
                computeNetSupply(totalSupply, totalDepositedConfirmed, withdrawn));
    }

    private static String computeNetSupply(String totalSupply, String deposited, String withdrawn) {
        if (totalSupply == null || deposited == null) {
            return null;
        }
        try {
            return SupplyUnits.parseWei(totalSupply)
                    .subtract(SupplyUnits.parseWei(deposited).subtract(SupplyUnits.parseWei(withdrawn)))
                    .toBigInteger()
                    .toString();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.fintech.supply.service;

import com.fintech.supply.dto.LayerOneSupply;
import com.fintech.supply.dto.LayerTwoSupply;
import com.fintech.supply.dto.ReconciledSupply;
import com.fintech.supply.dto.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;

import static com.fintech.supply.SupplyFixtures.layerOne;
import static com.fintech.supply.SupplyFixtures.layerTwo;
import static com.fintech.supply.SupplyFixtures.wei;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SupplyValidator.
 */
class SupplyValidatorTest {

    private final SupplyValidator validator = new SupplyValidator();

    @Nested
    @DisplayName("Layer One Validation Tests")
    class LayerOneTests {

        @Test
        @DisplayName("Should accept consistent layer one facts")
        void shouldAcceptConsistentFacts() {
            // When
            ValidationResult result = validator.validateLayerOne(layerOne());

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a missing field")
        void shouldRejectMissingField() {
            // Given
            LayerOneSupply supply = layerOne().toBuilder().lockedSupply(null).build();

            // When
            ValidationResult result = validator.validateLayerOne(supply);

            // Then
            assertThat(result.getErrors()).containsExactly("L1 lockedSupply is missing");
        }

        @Test
        @DisplayName("Should reject a negative amount")
        void shouldRejectNegativeAmount() {
            // Given
            LayerOneSupply supply = layerOne().toBuilder().liquidSupply("-5").build();

            // When
            ValidationResult result = validator.validateLayerOne(supply);

            // Then
            assertThat(result.getErrors()).containsExactly("L1 liquidSupply cannot be negative: -5");
        }

        @Test
        @DisplayName("Should reject an amount that is not an integer")
        void shouldRejectUnparseableAmount() {
            // Given
            LayerOneSupply supply = layerOne().toBuilder().totalSupply("lots").build();

            // When
            ValidationResult result = validator.validateLayerOne(supply);

            // Then
            assertThat(result.getErrors())
                    .containsExactly("L1 validation error: totalSupply is not an integer amount (lots)");
        }

        @Test
        @DisplayName("Should reject circulating supply above total supply")
        void shouldRejectCirculatingAboveTotal() {
            // Given
            LayerOneSupply supply = layerOne().toBuilder().circulatingSupply(wei("10000000001")).build();

            // When
            ValidationResult result = validator.validateLayerOne(supply);

            // Then
            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrors()).singleElement().asString()
                    .startsWith("L1 circulatingSupply (")
                    .contains("cannot exceed totalSupply");
        }

        @Test
        @DisplayName("Should warn when total differs from locked plus liquid beyond tolerance")
        void shouldWarnOnRelationshipMismatch() {
            // Given
            LayerOneSupply supply = layerOne().toBuilder().liquidSupply(wei("7000000000")).build();

            // When
            ValidationResult result = validator.validateLayerOne(supply);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).singleElement().asString()
                    .startsWith("L1 supply relationship inconsistency");
        }

        @Test
        @DisplayName("Should warn about zero amounts without failing")
        void shouldWarnOnZeroAmount() {
            // Given
            LayerOneSupply supply = layerOne().toBuilder().lockedSupplyGenesis("0").build();

            // When
            ValidationResult result = validator.validateLayerOne(supply);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).contains("L1 lockedSupplyGenesis is zero");
        }
    }

    @Nested
    @DisplayName("Layer Two Validation Tests")
    class LayerTwoTests {

        @Test
        @DisplayName("Should accept consistent layer two facts")
        void shouldAcceptConsistentFacts() {
            // When
            ValidationResult result = validator.validateLayerTwo(layerTwo());

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("Should reject incomplete facts")
        void shouldRejectIncompleteFacts() {
            // When
            ValidationResult result = validator.validateLayerTwo(LayerTwoSupply.of("1000", null, "0"));

            // Then
            assertThat(result.getErrors())
                    .containsExactly("L2 data is incomplete: missing totalSupply or totalDepositedConfirmed");
        }

        @Test
        @DisplayName("Should reject deposits above total supply")
        void shouldRejectDepositsAboveTotal() {
            // When
            ValidationResult result = validator.validateLayerTwo(LayerTwoSupply.of("100", "150", "10"));

            // Then
            assertThat(result.getErrors())
                    .containsExactly("L2 totalDepositedConfirmed (150) cannot exceed totalSupply (100)");
            assertThat(result.getWarnings()).singleElement().asString()
                    .startsWith("L2 net supply is negative (-40)");
        }

        @Test
        @DisplayName("Should reject negative amounts")
        void shouldRejectNegativeAmounts() {
            // When
            ValidationResult result = validator.validateLayerTwo(LayerTwoSupply.of("100", "50", "-1"));

            // Then
            assertThat(result.getErrors()).containsExactly("L2 totalWithdrawn cannot be negative: -1");
        }
    }

    @Nested
    @DisplayName("Reconciled Validation Tests")
    class ReconciledTests {

        private final SupplyReconciler reconciler = new SupplyReconciler(Clock.systemUTC());

        @Test
        @DisplayName("Should accept a reconciliation of consistent facts")
        void shouldAcceptConsistentReconciliation() {
            // Given
            ReconciledSupply supply = reconciler.reconcile(layerOne(), layerTwo());

            // When
            ValidationResult result = validator.validateReconciled(supply, layerOne(), layerTwo());

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("Should reject circulating supply above total supply")
        void shouldRejectCirculatingAboveTotal() {
            // Given
            ReconciledSupply supply = reconciler.reconcile(layerOne(), layerTwo()).toBuilder()
                    .circulatingSupply(new BigDecimal("20000000000"))
                    .build();

            // When
            ValidationResult result = validator.validateReconciled(supply, layerOne(), layerTwo());

            // Then
            assertThat(result.getErrors()).singleElement().asString()
                    .startsWith("Reconciled circulatingSupply (20000000000) cannot exceed totalSupply");
        }

        @Test
        @DisplayName("Should reject a non-positive total and a negative circulating supply")
        void shouldRejectNonPositiveFigures() {
            // Given
            ReconciledSupply supply = ReconciledSupply.builder()
                    .totalSupply(BigDecimal.ZERO)
                    .circulatingSupply(new BigDecimal("-1"))
                    .lockedSupply(BigDecimal.ZERO)
                    .liquidSupply(BigDecimal.ZERO)
                    .build();

            // When
            ValidationResult result = validator.validateReconciled(supply, layerOne(), layerTwo());

            // Then
            assertThat(result.getErrors()).contains(
                    "Reconciled totalSupply must be positive",
                    "Reconciled circulatingSupply cannot be negative");
        }

        @Test
        @DisplayName("Should warn when the total falls well below the layer one total")
        void shouldWarnWhenTotalDropsBelowLayerOne() {
            // Given - layer two net supply of -200M tokens
            LayerTwoSupply drained = LayerTwoSupply.of(wei("100000000"), wei("300000000"), "0");
            ReconciledSupply supply = reconciler.reconcile(layerOne(), drained);

            // When
            ValidationResult result = validator.validateReconciled(supply, layerOne(), drained);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).singleElement().asString()
                    .contains("appears lower than expected");
        }
    }
}

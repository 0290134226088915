package dev.pekelund.billsplit.settlement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class SettlementPolicyTest {

    @Test
    void defaultsMatchDocumentedThresholds() {
        SettlementPolicy policy = SettlementPolicy.defaults();

        assertThat(policy.warningVariancePercent()).isEqualByComparingTo("1");
        assertThat(policy.fatalVariancePercent()).isEqualByComparingTo("10");
        assertThat(policy.minimumSettlementAmount()).isEqualByComparingTo("0.01");
        assertThat(policy.discrepancyTolerance()).isEqualByComparingTo("0.05");
        assertThat(policy.currencySymbol()).isEqualTo("$");
    }

    @Test
    void rejectsWarningThresholdAboveFatalThreshold() {
        assertThatThrownBy(() -> new SettlementPolicy(new BigDecimal("11"), BigDecimal.TEN, BigDecimal.ZERO,
            BigDecimal.ZERO, "$"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not exceed");
    }

    @Test
    void rejectsNegativeThresholds() {
        assertThatThrownBy(() -> new SettlementPolicy(BigDecimal.ONE, BigDecimal.TEN, new BigDecimal("-0.01"),
            BigDecimal.ZERO, "$"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fallsBackToDollarSign() {
        SettlementPolicy policy = new SettlementPolicy(BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ZERO,
            BigDecimal.ZERO, null);

        assertThat(policy.currencySymbol()).isEqualTo("$");
    }
}

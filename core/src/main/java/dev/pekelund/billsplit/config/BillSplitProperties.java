package dev.pekelund.billsplit.config;

import dev.pekelund.billsplit.settlement.SettlementPolicy;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billsplit.settlement")
public class BillSplitProperties {

    /**
     * Variance between allocated items and the entered total, in percent, above which a warning is returned.
     */
    private BigDecimal warningVariancePercent = SettlementPolicy.DEFAULT_WARNING_VARIANCE_PERCENT;

    /**
     * Variance, in percent, above which the session is rejected.
     */
    private BigDecimal fatalVariancePercent = SettlementPolicy.DEFAULT_FATAL_VARIANCE_PERCENT;

    /**
     * Settlements at or below this amount are dropped as insignificant.
     */
    private BigDecimal minimumSettlementAmount = SettlementPolicy.DEFAULT_MINIMUM_SETTLEMENT_AMOUNT;

    /**
     * Gap between the item sum and the entered total tolerated by the readiness checks.
     */
    private BigDecimal discrepancyTolerance = SettlementPolicy.DEFAULT_DISCREPANCY_TOLERANCE;

    /**
     * Symbol prefixed to amounts in settlement explanations.
     */
    private String currencySymbol = SettlementPolicy.DEFAULT_CURRENCY_SYMBOL;

    public BigDecimal getWarningVariancePercent() {
        return warningVariancePercent;
    }

    public void setWarningVariancePercent(BigDecimal warningVariancePercent) {
        this.warningVariancePercent = warningVariancePercent;
    }

    public BigDecimal getFatalVariancePercent() {
        return fatalVariancePercent;
    }

    public void setFatalVariancePercent(BigDecimal fatalVariancePercent) {
        this.fatalVariancePercent = fatalVariancePercent;
    }

    public BigDecimal getMinimumSettlementAmount() {
        return minimumSettlementAmount;
    }

    public void setMinimumSettlementAmount(BigDecimal minimumSettlementAmount) {
        this.minimumSettlementAmount = minimumSettlementAmount;
    }

    public BigDecimal getDiscrepancyTolerance() {
        return discrepancyTolerance;
    }

    public void setDiscrepancyTolerance(BigDecimal discrepancyTolerance) {
        this.discrepancyTolerance = discrepancyTolerance;
    }

    public String getCurrencySymbol() {
        return currencySymbol;
    }

    public void setCurrencySymbol(String currencySymbol) {
        this.currencySymbol = currencySymbol;
    }

    public SettlementPolicy toPolicy() {
        return new SettlementPolicy(warningVariancePercent, fatalVariancePercent, minimumSettlementAmount,
            discrepancyTolerance, currencySymbol);
    }
}

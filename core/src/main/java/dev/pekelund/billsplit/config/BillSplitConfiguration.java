package dev.pekelund.billsplit.config;

import dev.pekelund.billsplit.settlement.BillSplitEngine;
import dev.pekelund.billsplit.settlement.PayerReimbursementEngine;
import dev.pekelund.billsplit.settlement.SessionReadiness;
import dev.pekelund.billsplit.settlement.SettlementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the settlement engine from {@code billsplit.settlement.*} properties.
 */
@Configuration
@EnableConfigurationProperties(BillSplitProperties.class)
public class BillSplitConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BillSplitConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SettlementPolicy settlementPolicy(BillSplitProperties properties) {
        SettlementPolicy policy = properties.toPolicy();
        log.info("Configured settlement policy - warning variance: {}%, fatal variance: {}%, minimum settlement: {},"
                + " discrepancy tolerance: {}, currency symbol: '{}'",
            policy.warningVariancePercent(), policy.fatalVariancePercent(), policy.minimumSettlementAmount(),
            policy.discrepancyTolerance(), policy.currencySymbol());
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean
    public BillSplitEngine billSplitEngine(SettlementPolicy settlementPolicy) {
        return new PayerReimbursementEngine(settlementPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionReadiness sessionReadiness(SettlementPolicy settlementPolicy) {
        return new SessionReadiness(settlementPolicy);
    }
}

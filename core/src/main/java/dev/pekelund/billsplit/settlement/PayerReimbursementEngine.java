package dev.pekelund.billsplit.settlement;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BillSplitEngine} that assumes the payer fronted the whole bill and has every
 * other participant reimburse the payer directly.
 *
 * <p>The pipeline is strictly linear: validate, allocate, check totals, reconcile cents,
 * generate settlements. Instances hold no mutable state and can be shared between threads.</p>
 */
public class PayerReimbursementEngine implements BillSplitEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(PayerReimbursementEngine.class);

    private final SplitValidator validator;
    private final ShareAllocator allocator;
    private final CentReconciler reconciler;
    private final SettlementGenerator generator;

    public PayerReimbursementEngine() {
        this(SettlementPolicy.defaults());
    }

    public PayerReimbursementEngine(SettlementPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        this.validator = new SplitValidator(policy);
        this.allocator = new ShareAllocator();
        this.reconciler = new CentReconciler();
        this.generator = new SettlementGenerator(policy.minimumSettlementAmount(),
            new ExplanationWriter(policy.currencySymbol()));
    }

    @Override
    public SplitResult computeSplits(SplitSession session) {
        Objects.requireNonNull(session, "session must not be null");
        try (SettlementMdc.Context ignored = SettlementMdc.open(session.sessionId())) {
            try {
                return settle(session);
            } catch (BillSplitException ex) {
                LOGGER.warn("Rejected session with {} participant(s) and {} item(s): {}",
                    session.participants().size(), session.items().size(), ex.getMessage());
                throw ex;
            }
        }
    }

    private SplitResult settle(SplitSession session) {
        SettlementMdc.setStage("validate");
        SplitValidator.Verdict verdict = validator.checkPreconditions(session);
        List<SettlementWarning> warnings = new ArrayList<>(verdict.warnings());
        if (!verdict.proceed()) {
            LOGGER.info("Nothing to settle for session with {} participant(s)", session.participants().size());
            logWarnings(warnings);
            return new SplitResult(List.of(), warnings, Map.of());
        }

        SettlementMdc.setStage("allocate");
        Map<String, BigDecimal> shares = allocator.allocate(session);
        BigDecimal allocated = Amounts.sum(shares.values());
        LOGGER.debug("Allocated {} across {} participant(s) from {} item(s)", allocated, shares.size(),
            session.items().size());

        SettlementMdc.setStage("check-totals");
        validator.checkTotals(allocated, session.enteredTotal()).ifPresent(warnings::add);

        SettlementMdc.setStage("reconcile");
        Map<String, Long> shareCents = reconciler.reconcile(shares, session.enteredTotal());

        SettlementMdc.setStage("settle");
        List<Settlement> settlements = generator.generate(session, shareCents);

        logWarnings(warnings);
        LOGGER.info("Computed {} settlement(s) towards payer '{}' with {} warning(s)", settlements.size(),
            session.payer(), warnings.size());
        return new SplitResult(settlements, warnings, toAmounts(shareCents));
    }

    private void logWarnings(List<SettlementWarning> warnings) {
        for (SettlementWarning warning : warnings) {
            LOGGER.warn("Settlement warning {}: {}", warning.type(), warning.message());
        }
    }

    private Map<String, BigDecimal> toAmounts(Map<String, Long> shareCents) {
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        shareCents.forEach((participant, cents) -> amounts.put(participant, Amounts.fromCents(cents)));
        return amounts;
    }
}

package com.phillippitts.freefleet.service.validation;

import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Strict gate for models routed in strict mode. A model passes only when
 * <ul>
 *   <li>{@code tier}: its tier is {@link CostTier#CONFIRMED_FREE}</li>
 *   <li>{@code confidence}: its confidence is at least 0.9</li>
 *   <li>{@code multi_source}: its confidence is exactly 1.0, i.e. a corroborated verdict</li>
 * </ul>
 * Rejected models are written to the audit log as {@code MODEL_BLOCKED}.
 */
@Component
public class UltraFreeValidator {

    private static final Logger LOG = LogManager.getLogger(UltraFreeValidator.class);

    static final double MIN_CONFIDENCE = 0.9;

    private final AuditLog auditLog;

    public UltraFreeValidator(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    public ValidationResult validate(FreeModel model) {
        List<String> failed = new ArrayList<>(3);
        if (model.tier() != CostTier.CONFIRMED_FREE) {
            failed.add("tier");
        }
        if (model.confidence() < MIN_CONFIDENCE) {
            failed.add("confidence");
        }
        if (model.confidence() != 1.0) {
            failed.add("multi_source");
        }

        ValidationResult result = new ValidationResult(failed.isEmpty(), failed, Instant.now());
        if (!result.safe()) {
            LOG.info("Blocked {} ({}, confidence {}): {}", model.qualifiedId(), model.tier(),
                    model.confidence(), failed);
            auditLog.modelBlocked("validator", model.qualifiedId(), failed);
        }
        return result;
    }
}

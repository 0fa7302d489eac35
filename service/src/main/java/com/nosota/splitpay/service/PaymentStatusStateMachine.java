package com.nosota.splitpay.service;

import com.nosota.splitpay.api.model.PaymentStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating PaymentStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *   UNPAID ──submit──► PENDING_APPROVAL ──approve──► APPROVED
 *     │                  ▲      │                      │
 *     │              resubmit   deny                  deny
 *     │                  │      ▼                      │
 *     └──────deny──────► DENIED ◄──────────────────────┘
 * </pre>
 *
 * <ul>
 *   <li>Resubmitting while PENDING_APPROVAL overwrites the amount (same-state transition)</li>
 *   <li>APPROVED cannot be resubmitted; only a deny moves it</li>
 *   <li>Deny is accepted from every state</li>
 * </ul>
 */
@Component
public class PaymentStatusStateMachine {

    private static final Map<PaymentStatus, Set<PaymentStatus>> ALLOWED_TRANSITIONS = Map.of(
            PaymentStatus.UNPAID, EnumSet.of(
                    PaymentStatus.PENDING_APPROVAL,
                    PaymentStatus.DENIED
            ),
            PaymentStatus.PENDING_APPROVAL, EnumSet.of(
                    PaymentStatus.APPROVED,
                    PaymentStatus.DENIED
            ),
            PaymentStatus.DENIED, EnumSet.of(
                    PaymentStatus.PENDING_APPROVAL
            ),
            PaymentStatus.APPROVED, EnumSet.of(
                    PaymentStatus.DENIED
            )
    );

    /**
     * Validates if a status transition is allowed. Same status is always allowed (no-op).
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(PaymentStatus fromStatus, PaymentStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        if (fromStatus == toStatus) {
            return true;
        }

        Set<PaymentStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public void validateTransition(PaymentStatus fromStatus, PaymentStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid payment status transition: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }
}

package org.nowstart.dca.service.dca.core;

import org.nowstart.dca.data.exception.DcaException;
import org.nowstart.dca.data.type.DcaErrorKind;
import org.nowstart.dca.data.type.DcaOutcome;

public record DcaRunResult(
        DcaOutcome outcome,
        DcaOrder order,
        DcaErrorKind errorKind,
        String message
) {

    public static DcaRunResult placed(DcaOrder order) {
        return new DcaRunResult(DcaOutcome.ORDER_PLACED, order, null, "Order placed");
    }

    public static DcaRunResult alreadyOrdered(int existingOrders) {
        return new DcaRunResult(
                DcaOutcome.ALREADY_ORDERED,
                null,
                null,
                "Already ordered in current window (" + existingOrders + " order(s))"
        );
    }

    public static DcaRunResult failed(DcaException exception) {
        return failed(exception, null);
    }

    /**
     * A failure that still carries the order, for runs that failed after the exchange accepted it.
     */
    public static DcaRunResult failed(DcaException exception, DcaOrder order) {
        return new DcaRunResult(DcaOutcome.FAILED, order, exception.getKind(), exception.getMessage());
    }

    public static DcaRunResult unexpected(Exception exception) {
        String message = exception.getMessage() == null ? exception.getClass().getName() : exception.getMessage();
        return new DcaRunResult(DcaOutcome.FAILED, null, DcaErrorKind.INTERNAL, message);
    }

    public boolean ok() {
        return outcome != DcaOutcome.FAILED;
    }
}

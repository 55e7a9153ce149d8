package hunter.opportunity;

/**
 * Delivers a brief to a destination channel.
 *
 * <p>Calls with the same {@code idempotencyKey} must have a single visible
 * effect and return the same receipt.
 */
public interface DeliveryService {
    DeliveryReceipt deliver(OpportunityBrief brief, String destination, String idempotencyKey)
            throws OpportunityServiceException;
}

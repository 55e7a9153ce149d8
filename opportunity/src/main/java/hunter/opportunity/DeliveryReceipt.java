package hunter.opportunity;

/** Result of delivering a brief. Repeated deliveries under one key return the same receipt. */
public record DeliveryReceipt(String deliveryId, String destination, String companyName, long deliveredAtMs) {
}

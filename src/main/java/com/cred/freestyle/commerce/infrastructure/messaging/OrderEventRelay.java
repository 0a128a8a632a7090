package com.cred.freestyle.commerce.infrastructure.messaging;

import com.cred.freestyle.commerce.infrastructure.cache.ProductCacheService;
import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderPlacedEvent;
import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards order events raised inside a transaction once it has committed.
 * A rolled-back checkout therefore never emits anything.
 *
 * @author Commerce Platform Team
 */
@Component
public class OrderEventRelay {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventRelay.class);

    private final OrderEventProducer orderEventProducer;
    private final ProductCacheService productCacheService;

    public OrderEventRelay(OrderEventProducer orderEventProducer, ProductCacheService productCacheService) {
        this.orderEventProducer = orderEventProducer;
        this.productCacheService = productCacheService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderPlaced(OrderPlacedEvent event) {
        logger.debug("Relaying order_placed for order {}", event.getOrderId());
        productCacheService.evictProducts(event.productIds());
        orderEventProducer.publishOrderPlaced(event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderStatusChanged(OrderStatusChangedEvent event) {
        logger.debug("Relaying order_status_changed for order {}: {} -> {}",
                event.getOrderId(), event.getPreviousStatus(), event.getNewStatus());
        productCacheService.evictProducts(event.getRestockedProductIds());
        orderEventProducer.publishOrderStatusChanged(event);
    }
}

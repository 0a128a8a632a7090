package com.cred.freestyle.commerce.infrastructure.messaging;

import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderPlacedEvent;
import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderStatusChangedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for order domain events.
 *
 * Topic partitioning strategy:
 * - Key: order_id (all events of one order land on the same partition,
 *   so consumers see placed -> paid -> shipped in order)
 *
 * Publishing is best-effort: the order is already committed when these
 * methods run, so failures are logged and never propagated.
 *
 * @author Commerce Platform Team
 */
@Service
public class OrderEventProducer {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventProducer.class);

    static final String ORDER_PLACED = "order_placed";
    static final String ORDER_STATUS_CHANGED = "order_status_changed";
    static final String EVENT_TYPE_HEADER = "event_type";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String orderTopic;

    public OrderEventProducer(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${commerce.kafka.order-topic:commerce-orders}") String orderTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.orderTopic = orderTopic;
    }

    /**
     * Publish order placed event.
     *
     * @param event Order placed event
     */
    public void publishOrderPlaced(OrderPlacedEvent event) {
        send(ORDER_PLACED, event.getOrderId(), event);
    }

    /**
     * Publish order status change event.
     *
     * @param event Status change event
     */
    public void publishOrderStatusChanged(OrderStatusChangedEvent event) {
        send(ORDER_STATUS_CHANGED, event.getOrderId(), event);
    }

    private void send(String eventType, String orderId, Object event) {
        try {
            String payload = objectMapper.writeValueAsString(new Envelope(eventType, event));
            ProducerRecord<String, String> record = new ProducerRecord<>(orderTopic, orderId, payload);
            record.headers().add(EVENT_TYPE_HEADER, eventType.getBytes(StandardCharsets.UTF_8));
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(record);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} event for order {}, partition: {}",
                            eventType, orderId, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} event for order {}", eventType, orderId, ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} event for order {}", eventType, orderId, e);
        } catch (Exception e) {
            logger.error("Error sending {} event for order {}", eventType, orderId, e);
        }
    }

    /**
     * Wire format: {"eventType": "...", "payload": {...}}.
     */
    static class Envelope {
        private final String eventType;
        private final Object payload;

        Envelope(String eventType, Object payload) {
            this.eventType = eventType;
            this.payload = payload;
        }

        public String getEventType() { return eventType; }
        public Object getPayload() { return payload; }
    }
}

package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves an order to the escrow payment already created for it.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the unique order_id column on escrow_payments
 * 3. Re-populate Redis after a database hit
 *
 * Redis failures never fail a request: the database is the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "escrow-order:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final EscrowPaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(EscrowPaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Finds the escrow payment ID recorded for an order.
     *
     * @param orderId order to look up
     * @return escrow payment ID if the order was already escrowed
     */
    public Optional<UUID> findEscrowForOrder(UUID orderId) {
        if (orderId == null) {
            throw new InvalidArgumentException("Order ID is required");
        }
        String redisKey = REDIS_KEY_PREFIX + orderId;

        if (redisTemplate.isPresent()) {
            try {
                String escrowId = redisTemplate.get().opsForValue().get(redisKey);
                if (escrowId != null) {
                    log.debug("Escrow for order {} found in Redis", orderId);
                    return Optional.of(UUID.fromString(escrowId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for order {}. Falling back to database. Error: {}",
                        orderId, e.getMessage());
            }
        }

        Optional<UUID> existing = paymentRepository.findByOrderId(orderId)
            .map(EscrowPaymentEntity::getId);

        existing.ifPresent(escrowId -> {
            log.debug("Escrow for order {} found in database", orderId);
            cache(redisKey, escrowId);
        });

        return existing;
    }

    /**
     * Records the order to escrow mapping in Redis. The database row written
     * with the escrow payment is the durable copy.
     */
    public void rememberEscrowForOrder(UUID orderId, UUID escrowPaymentId) {
        if (orderId == null || escrowPaymentId == null) {
            throw new InvalidArgumentException("Order ID and escrow payment ID are required");
        }
        cache(REDIS_KEY_PREFIX + orderId, escrowPaymentId);
    }

    private void cache(String redisKey, UUID escrowPaymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, escrowPaymentId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache {} in Redis: {}", redisKey, e.getMessage());
        }
    }
}

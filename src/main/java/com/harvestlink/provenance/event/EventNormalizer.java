package com.harvestlink.provenance.event;

import com.harvestlink.provenance.event.payload.BatchCreatedPayload;
import com.harvestlink.provenance.event.payload.BatchLocationUpdatedPayload;
import com.harvestlink.provenance.event.payload.BatchPurchasedPayload;
import com.harvestlink.provenance.event.payload.EventPayload;
import com.harvestlink.provenance.event.payload.OwnershipTransferredPayload;
import com.harvestlink.provenance.event.payload.ProductCreatedPayload;
import com.harvestlink.provenance.event.payload.StatusUpdatedPayload;
import com.harvestlink.provenance.ledger.RawLog;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns positional raw log arguments into typed payloads.
 *
 * Argument order follows the contract's event declarations, e.g.
 * ProductCreated(productId, name, farmer, price). Anything that does not fit
 * is rejected with {@link EventNormalizationException}; nothing is coerced
 * beyond numeric widening.
 */
@Component
public class EventNormalizer {

    public DomainEvent normalize(DomainEventKind kind, RawLog raw, Instant occurredAt) {
        if (raw.getTransactionHash() == null || raw.getTransactionHash().isBlank()) {
            throw new EventNormalizationException(kind.getEventName() + " log has no transaction hash");
        }
        SequenceKey key;
        try {
            key = new SequenceKey(raw.getBlockNumber(), raw.getLogIndex());
        } catch (IllegalArgumentException e) {
            throw new EventNormalizationException(e.getMessage());
        }
        return new DomainEvent(kind, key, raw.getTransactionHash(), occurredAt, payload(kind, new Args(kind, raw)));
    }

    private EventPayload payload(DomainEventKind kind, Args args) {
        switch (kind) {
            case PRODUCT_CREATED:
                args.expect(4);
                return new ProductCreatedPayload(args.id(0), args.text(1), args.address(2), args.amount(3));
            case BATCH_CREATED:
                args.expect(4);
                return new BatchCreatedPayload(args.id(0), args.ids(1), args.address(2), args.text(3));
            case OWNERSHIP_TRANSFERRED:
                args.expect(3);
                return new OwnershipTransferredPayload(args.id(0), args.address(1), args.address(2));
            case STATUS_UPDATED:
                args.expect(3);
                return new StatusUpdatedPayload(args.id(0), args.statusCode(1), args.address(2));
            case BATCH_LOCATION_UPDATED:
                args.expect(3);
                return new BatchLocationUpdatedPayload(args.id(0), args.text(1), args.address(2));
            case BATCH_PURCHASED:
                args.expect(4);
                return new BatchPurchasedPayload(args.id(0), args.address(1), args.address(2), args.amount(3));
            default:
                throw new EventNormalizationException("Unsupported event kind " + kind);
        }
    }

    /**
     * Positional accessor that reports the offending argument on failure.
     */
    private static final class Args {
        private final DomainEventKind kind;
        private final List<Object> values;

        Args(DomainEventKind kind, RawLog raw) {
            this.kind = kind;
            this.values = raw.getArgs() == null ? List.of() : raw.getArgs();
        }

        void expect(int count) {
            if (values.size() < count) {
                throw fail(-1, "expected " + count + " arguments, got " + values.size());
            }
        }

        long id(int index) {
            BigInteger value = integer(index, values.get(index));
            if (value.signum() < 0 || value.bitLength() > 63) {
                throw fail(index, "id out of range: " + value);
            }
            return value.longValue();
        }

        List<Long> ids(int index) {
            Object value = values.get(index);
            if (!(value instanceof List<?> list) || list.isEmpty()) {
                throw fail(index, "expected a non-empty id list");
            }
            List<Long> ids = new ArrayList<>(list.size());
            for (Object element : list) {
                BigInteger id = integer(index, element);
                if (id.signum() < 0 || id.bitLength() > 63) {
                    throw fail(index, "id out of range: " + id);
                }
                ids.add(id.longValue());
            }
            return ids;
        }

        BigInteger amount(int index) {
            BigInteger value = integer(index, values.get(index));
            if (value.signum() < 0) {
                throw fail(index, "negative amount");
            }
            return value;
        }

        int statusCode(int index) {
            BigInteger value = integer(index, values.get(index));
            if (value.signum() < 0 || value.bitLength() > 31) {
                throw fail(index, "status code out of range: " + value);
            }
            return value.intValue();
        }

        String address(int index) {
            Object value = values.get(index);
            if (!(value instanceof String text) || text.isBlank()) {
                throw fail(index, "expected an address");
            }
            return text;
        }

        String text(int index) {
            Object value = values.get(index);
            if (!(value instanceof String text)) {
                throw fail(index, "expected text");
            }
            return text;
        }

        private BigInteger integer(int index, Object value) {
            if (value instanceof BigInteger big) {
                return big;
            }
            if (value instanceof Long || value instanceof Integer) {
                return BigInteger.valueOf(((Number) value).longValue());
            }
            if (value instanceof String text) {
                try {
                    return new BigInteger(text);
                } catch (NumberFormatException e) {
                    throw fail(index, "not a number: " + text);
                }
            }
            throw fail(index, "expected an integer");
        }

        private EventNormalizationException fail(int index, String problem) {
            String where = index < 0 ? "" : " argument " + index;
            return new EventNormalizationException(kind.getEventName() + where + ": " + problem);
        }
    }
}

package com.harvestlink.provenance.ledger;

import java.math.BigInteger;
import java.util.List;

/**
 * State-changing calls of the ledger contract.
 */
public sealed interface ContractCall {

    String functionName();

    /**
     * Native value sent along with the call (wei).
     */
    default BigInteger value() {
        return BigInteger.ZERO;
    }

    record CreateProduct(String name, String description, String contentHash, BigInteger priceWei)
            implements ContractCall {
        public CreateProduct {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Product name is required");
            }
            if (priceWei == null || priceWei.signum() < 0) {
                throw new IllegalArgumentException("Product price must be non-negative");
            }
        }

        @Override
        public String functionName() {
            return "createProduct";
        }
    }

    record CreateBatch(List<Long> productIds, String location) implements ContractCall {
        public CreateBatch {
            if (productIds == null || productIds.isEmpty()) {
                throw new IllegalArgumentException("A batch needs at least one product");
            }
            productIds = List.copyOf(productIds);
        }

        @Override
        public String functionName() {
            return "createBatch";
        }
    }

    record UpdateBatchLocation(long batchId, String location) implements ContractCall {
        @Override
        public String functionName() {
            return "updateBatchLocation";
        }
    }

    record PurchaseBatch(long batchId, BigInteger valueWei) implements ContractCall {
        public PurchaseBatch {
            if (valueWei == null || valueWei.signum() <= 0) {
                throw new IllegalArgumentException("Purchase value must be positive");
            }
        }

        @Override
        public String functionName() {
            return "purchaseBatch";
        }

        @Override
        public BigInteger value() {
            return valueWei;
        }
    }
}

package com.harvestlink.provenance.ledger;

import lombok.Value;

import java.util.List;

/**
 * A product together with every address that has held it, oldest first.
 */
@Value
public class ProductWithHistory {
    Product product;
    List<String> holders;
}

package com.cartsafety.signal.service;

import com.cartsafety.common.config.ProductDefinition;

import java.time.LocalDate;
import java.util.List;

/**
 * A drug-event pair resolved against the configured products.
 *
 * @param product      null when the drug is not a configured product
 * @param approvalDate explicit override, else the configured one, else null
 */
record SignalPair(String drug, String event, ProductDefinition product, List<String> searchTerms,
                  LocalDate asOf, LocalDate approvalDate) {

    static SignalPair of(ProductDefinition product, String event, LocalDate asOf) {
        return new SignalPair(product.brand(), event, product, product.searchTerms(), asOf, product.approvalDate());
    }

    String brand() {
        return product == null ? null : product.brand();
    }
}

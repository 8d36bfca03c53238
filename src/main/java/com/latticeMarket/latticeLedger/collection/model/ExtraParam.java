package com.latticeMarket.latticeLedger.collection.model;

/**
 * Free-form rendering parameter.
 */
public record ExtraParam(String key, String value) {}

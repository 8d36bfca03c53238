package com.latticeMarket.latticeLedger.collection.model;

/**
 * Weighted edge between two lattice nodes, by node index.
 */
public record LatticeConnection(int from, int to, long weight) {}

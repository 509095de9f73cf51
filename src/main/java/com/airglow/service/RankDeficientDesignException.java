package com.airglow.service;

public class RankDeficientDesignException extends RuntimeException {

    public RankDeficientDesignException(int rows, int columns) {
        super(String.format("Design matrix has %d columns for %d usable samples; need more samples than columns",
            columns, rows));
    }
}

package com.airglow.model;

// Columns [0, continuumColumns) are continuum terms, the rest line profiles
public class DesignMatrix {
    public final double[][] data;
    public final int continuumColumns;

    public DesignMatrix(double[][] data, int continuumColumns) {
        if (data.length > 0 && continuumColumns > data[0].length) {
            throw new IllegalArgumentException("Continuum block wider than the matrix: " + continuumColumns);
        }
        this.data = data;
        this.continuumColumns = continuumColumns;
    }

    public int rows() {
        return data.length;
    }

    public int columns() {
        return data.length == 0 ? continuumColumns : data[0].length;
    }

    public int lineColumns() {
        return columns() - continuumColumns;
    }
}

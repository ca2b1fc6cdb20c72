package com.dynamics.sfg.infer;

import java.util.Arrays;

/**
 * A random quantity represented by its draws: {@code draws x dim} values,
 * row-major by draw.
 *
 * A deterministic quantity is an ensemble of one draw and broadcasts against
 * any number of draws, the same way a scalar broadcasts against a vector.
 */
public final class Ensemble {
    private final int draws;
    private final int dim;
    private final double[] data;

    public Ensemble(int draws, int dim, double[] data) {
        if (draws < 1 || dim < 1 || data.length != draws * dim)
            throw new IllegalArgumentException("Ensemble shape [" + draws + "][" + dim + "] does not match "
                    + data.length + " values");
        this.draws = draws;
        this.dim = dim;
        this.data = data;
    }

    /** A deterministic value. */
    public static Ensemble constant(double[] values) {
        return new Ensemble(1, values.length, values.clone());
    }

    /** Packs {@code [draw][element]} rows. */
    public static Ensemble of(double[][] rows) {
        int dim = rows[0].length;
        double[] data = new double[rows.length * dim];
        for (int d = 0; d < rows.length; d++)
            System.arraycopy(rows[d], 0, data, d * dim, dim);
        return new Ensemble(rows.length, dim, data);
    }

    public int draws() {
        return draws;
    }

    public int dim() {
        return dim;
    }

    public boolean isDeterministic() {
        return draws == 1;
    }

    /** Value of an element in a draw, broadcasting single draws and scalars. */
    public double get(int draw, int element) {
        return data[(draws == 1 ? 0 : draw) * dim + (dim == 1 ? 0 : element)];
    }

    /** The elements of one draw. */
    public double[] draw(int draw) {
        int d = draws == 1 ? 0 : draw;
        return Arrays.copyOfRange(data, d * dim, d * dim + dim);
    }

    @Override
    public String toString() {
        return "Ensemble[" + draws + "x" + dim + "]";
    }
}

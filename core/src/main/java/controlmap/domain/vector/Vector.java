package controlmap.domain.vector;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Represents an embedding vector. The values are copied on the way in and on the way out, so a Vector
 * is immutable.
 *
 * @param value The vector components
 */
public record Vector(float... value) {

    public Vector(final float... value) {
        this.value = Objects.requireNonNull(value).clone();
    }

    public Vector(final double[] values) {
        this(toFloats(values));
    }

    public Vector(final List<Double> values) {
        this(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    @Override
    public float[] value() {
        return value.clone();
    }

    public int dimension() {
        return value.length;
    }

    public float get(final int index) {
        if (index < 0 || index >= value.length) {
            throw new IndexOutOfBoundsException("Index: " + index + " is out of bound");
        }
        return value[index];
    }

    public double dotProduct(final Vector other) {
        if (other.dimension() != dimension()) {
            throw new IllegalArgumentException("Vector dimensions differ: " + dimension() + " and " + other.dimension());
        }

        double dotProduct = 0.0;
        for (int i = 0; i < value.length; i++) {
            dotProduct += (double) value[i] * other.value[i];
        }
        return dotProduct;
    }

    public double norm() {
        double sum = 0.0;
        for (final float element : value) {
            sum += (double) element * element;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns the L2 normalized copy of this vector. A zero vector has no direction and is returned as is.
     */
    public Vector normalize() {
        final double norm = norm();
        if (norm == 0.0) {
            return this;
        }

        final float[] normalized = new float[value.length];
        for (int i = 0; i < value.length; i++) {
            normalized[i] = (float) (value[i] / norm);
        }
        return new Vector(normalized);
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof Vector vector && Arrays.equals(value, vector.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Vector" + Arrays.toString(value);
    }

    private static float[] toFloats(final double[] values) {
        final float[] floats = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            floats[i] = (float) values[i];
        }
        return floats;
    }
}

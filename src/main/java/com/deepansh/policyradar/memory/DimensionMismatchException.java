package com.deepansh.policyradar.memory;

import lombok.Getter;

/**
 * Upsert of vectors whose length differs from the dimension a namespace was created with.
 */
@Getter
public class DimensionMismatchException extends RuntimeException {

    private final String namespace;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String namespace, int expected, int actual) {
        super("Namespace " + namespace + " holds " + expected + "-d vectors, got " + actual);
        this.namespace = namespace;
        this.expected = expected;
        this.actual = actual;
    }
}

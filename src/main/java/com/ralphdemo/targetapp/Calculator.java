package com.ralphdemo.targetapp;

/**
 * Stateless integer calculator.
 *
 * <p>Results follow Java {@code int} arithmetic: values outside the
 * {@code int} range wrap around and are not reported.
 */
public class Calculator {

    public int add(int a, int b) {
        return a + b;
    }

    public int multiply(int a, int b) {
        return a * b;
    }
}

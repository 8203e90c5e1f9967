package com.ralphdemo.targetapp;

import org.junit.Test;
import org.junit.Before;
import static org.junit.Assert.*;

public class CalculatorTest {
    private static final int[] SAMPLES = {0, 1, -1, 3, -5, 42, 100, -100, 12345};

    private Calculator calculator;

    @Before
    public void setUp() {
        calculator = new Calculator();
    }

    @Test
    public void testAddReturnsSum() {
        assertEquals(8, calculator.add(5, 3));
    }

    @Test
    public void testMultiplyReturnsProduct() {
        assertEquals(12, calculator.multiply(4, 3));
    }

    @Test
    public void testAddition() {
        assertEquals(-2, calculator.add(-5, 3));
        assertEquals(0, calculator.add(-5, 5));
        assertEquals(-10, calculator.add(-5, -5));
    }

    @Test
    public void testMultiplication() {
        assertEquals(0, calculator.multiply(0, 100));
        assertEquals(-15, calculator.multiply(3, -5));
        assertEquals(25, calculator.multiply(-5, -5));
    }

    @Test
    public void testCommutativity() {
        for (int a : SAMPLES) {
            for (int b : SAMPLES) {
                assertEquals(calculator.add(a, b), calculator.add(b, a));
                assertEquals(calculator.multiply(a, b), calculator.multiply(b, a));
            }
        }
    }

    @Test
    public void testIdentity() {
        for (int a : SAMPLES) {
            assertEquals(a, calculator.add(a, 0));
            assertEquals(a, calculator.multiply(a, 1));
        }
    }

    @Test
    public void testOverflowWrapsAround() {
        assertEquals(Integer.MIN_VALUE, calculator.add(Integer.MAX_VALUE, 1));
        assertEquals(Integer.MAX_VALUE, calculator.add(Integer.MIN_VALUE, -1));
        assertEquals(-2, calculator.multiply(Integer.MAX_VALUE, 2));
    }
}

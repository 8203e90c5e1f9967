package com.ralphdemo.targetapp;

import java.io.PrintStream;

/**
 * Command-line entry point for the Calculator.
 */
public class MainApp {

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the application and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Calculator calc = new Calculator();

        if (args.length == 0) {
            printDemo(calc, out);
            return 0;
        }

        if (args.length == 1 && ("--help".equals(args[0]) || "-h".equals(args[0]))) {
            printUsage(out);
            return 0;
        }

        try {
            if (args.length != 3) {
                throw new IllegalArgumentException("expected 3 arguments but got " + args.length);
            }
            Operation operation = Operation.fromName(args[0]);
            int a = parseOperand(args[1]);
            int b = parseOperand(args[2]);
            out.println(format(operation, a, b, operation.apply(calc, a, b)));
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return 1;
        }
    }

    private static void printDemo(Calculator calc, PrintStream out) {
        out.println("=== Calculator Demo ===");
        out.println(format(Operation.ADD, 5, 3, calc.add(5, 3)));
        out.println(format(Operation.MULTIPLY, 4, 3, calc.multiply(4, 3)));
        out.println(format(Operation.ADD, -5, 3, calc.add(-5, 3)));
        out.println(format(Operation.MULTIPLY, 0, 100, calc.multiply(0, 100)));
    }

    private static int parseOperand(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer operand: " + value, e);
        }
    }

    static String format(Operation operation, int a, int b, int result) {
        return a + " " + operation.getSymbol() + " " + b + " = " + result;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: targetapp [<operation> <a> <b>]");
        out.println();
        out.println("Operations:");
        out.println("  add, +        a + b");
        out.println("  multiply, *   a * b");
        out.println();
        out.println("With no arguments a short demo is printed.");
    }
}

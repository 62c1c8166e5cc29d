package io.github.eutro.qdebug.assertion;

import io.github.eutro.qdebug.util.Strings;

/**
 * A complex amplitude.
 */
public final class Complex {
    public final double real;
    public final double imaginary;

    public Complex(double real, double imaginary) {
        this.real = real;
        this.imaginary = imaginary;
    }

    public double normSquared() {
        return real * real + imaginary * imaginary;
    }

    /**
     * Parse a complex literal: {@code a}, {@code bi}, {@code a+bi} or {@code a-bi}.
     * Whitespace is ignored, and a lone {@code i} stands for {@code 1i}.
     *
     * @param text The literal.
     * @return The number.
     * @throws AssertionSyntaxException If the literal is malformed.
     */
    public static Complex parse(String text) {
        String s = Strings.removeWhitespace(text);
        if (s.isEmpty()) {
            throw new AssertionSyntaxException("Empty amplitude.");
        }
        try {
            if (!s.endsWith("i")) {
                return new Complex(Double.parseDouble(s), 0);
            }
            String body = s.substring(0, s.length() - 1);
            int split = -1;
            for (int i = body.length() - 1; i > 0; i--) {
                char c = body.charAt(i);
                char prev = body.charAt(i - 1);
                if ((c == '+' || c == '-') && prev != 'e' && prev != 'E') {
                    split = i;
                    break;
                }
            }
            if (split == -1) {
                return new Complex(0, parseImaginary(body));
            }
            return new Complex(Double.parseDouble(body.substring(0, split)), parseImaginary(body.substring(split)));
        } catch (NumberFormatException e) {
            throw new AssertionSyntaxException("Invalid amplitude " + text.trim() + ".", e);
        }
    }

    private static double parseImaginary(String coefficient) {
        switch (coefficient) {
            case "":
            case "+":
                return 1;
            case "-":
                return -1;
            default:
                return Double.parseDouble(coefficient);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Complex complex = (Complex) o;
        return Double.compare(complex.real, real) == 0 && Double.compare(complex.imaginary, imaginary) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(real) + Double.hashCode(imaginary);
    }

    @Override
    public String toString() {
        if (imaginary == 0) return Double.toString(real);
        return real + (imaginary < 0 ? "-" : "+") + Math.abs(imaginary) + "i";
    }
}

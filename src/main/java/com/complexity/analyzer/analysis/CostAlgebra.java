package com.complexity.analyzer.analysis;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximate algebra over complexity terms such as {@code 1}, {@code n},
 * {@code n^3} or {@code max(n, n log n)}.
 *
 * Addition models sequential composition and multiplication models
 * iteration. Shapes the rules do not recognize are kept as literal composite
 * terms instead of being evaluated.
 */
public final class CostAlgebra {

    public static final String CONSTANT = "1";
    public static final String LINEAR = "n";

    private static final Pattern POWER = Pattern.compile("n\\^(\\d+)");

    private CostAlgebra() {
    }

    /**
     * Cost of running {@code first} and then {@code second}.
     */
    public static String add(String first, String second) {
        if (CONSTANT.equals(first)) {
            return second;
        }
        if (CONSTANT.equals(second)) {
            return first;
        }
        if (first.equals(second)) {
            return first;
        }

        Integer p = exponent(first);
        Integer q = exponent(second);
        if (p != null && q != null) {
            return power(Math.max(p, q));
        }
        return "max(" + first + ", " + second + ")";
    }

    /**
     * Cost of {@code count} repetitions of something costing {@code each}.
     */
    public static String multiply(String count, String each) {
        if (CONSTANT.equals(count)) {
            return each;
        }
        if (CONSTANT.equals(each)) {
            return count;
        }
        if (LINEAR.equals(count) && LINEAR.equals(each)) {
            return "n^2";
        }

        Integer p = exponent(count);
        if (p != null && LINEAR.equals(each)) {
            return power(p + 1);
        }
        Integer q = exponent(each);
        if (LINEAR.equals(count) && q != null) {
            return power(q + 1);
        }
        return count + " * " + each;
    }

    /**
     * @return the exponent of an {@code n^p} term, or null for any other shape
     */
    static Integer exponent(String term) {
        Matcher matcher = POWER.matcher(term);
        if (!matcher.matches()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group(1));
        } catch (NumberFormatException e) {
            // exponent too large to be meaningful: treat as an opaque term
            return null;
        }
    }

    private static String power(int exponent) {
        return "n^" + exponent;
    }
}

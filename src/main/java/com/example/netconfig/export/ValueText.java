package com.example.netconfig.export;

import com.example.netconfig.domain.Activation;

import java.math.BigDecimal;
import java.util.List;
import java.util.StringJoiner;

/**
 * Text rendering of numbers and number sequences shared by the flat encoders.
 *
 * <p>Doubles use the shortest round-trip digits, written plainly while the
 * decimal exponent is in [-4, 16) and as {@code 1.5e-05} / {@code 1e+16}
 * outside it. Whole values keep a trailing {@code .0}.</p>
 */
final class ValueText {

    static final String NONE = "none";

    private ValueText() {
    }

    static String number(Number n) {
        if (n instanceof Double d) {
            return decimal(d);
        }
        if (n instanceof Float f) {
            return decimal(f.doubleValue());
        }
        return String.valueOf(n);
    }

    static String decimal(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0.0) {
            return (1.0 / d) < 0 ? "-0.0" : "0.0";
        }
        BigDecimal value = BigDecimal.valueOf(d).stripTrailingZeros();
        String digits = value.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - value.scale();

        if (exponent >= -4 && exponent < 16) {
            String plain = value.toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }

        StringBuilder sb = new StringBuilder();
        if (value.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int abs = Math.abs(exponent);
        if (abs < 10) {
            sb.append('0');
        }
        sb.append(abs);
        return sb.toString();
    }

    static String join(List<? extends Number> values, String separator) {
        StringJoiner j = new StringJoiner(separator);
        for (Number v : values) {
            j.add(number(v));
        }
        return j.toString();
    }

    static String activation(Activation activation) {
        return activation == null ? NONE : activation.value();
    }
}

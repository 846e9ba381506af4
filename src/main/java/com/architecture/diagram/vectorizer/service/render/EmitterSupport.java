package com.architecture.diagram.vectorizer.service.render;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Formatting helpers shared by the emitters.
 */
final class EmitterSupport {

    private EmitterSupport() {
    }

    /**
     * Locale-independent number text: integral values without a fraction,
     * others with at most two decimals and no trailing zeros.
     */
    static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    /**
     * Escape text for an XML attribute value or text node.
     */
    static String xml(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '"': out.append("&quot;"); break;
                case '\'': out.append("&#39;"); break;
                case '\n': out.append("&#10;"); break;
                case '\r': break;
                default: out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Render an attribute map with keys in sorted order.
     */
    static String sortedAttributes(Map<String, String> attributes, String pairSeparator, String delimiter) {
        StringJoiner joiner = new StringJoiner(delimiter);
        new TreeMap<>(attributes).forEach((key, value) -> joiner.add(key + pairSeparator + value));
        return joiner.toString();
    }
}

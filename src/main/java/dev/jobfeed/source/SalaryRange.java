package dev.jobfeed.source;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Salary bounds extracted from free text such as "$80,000 - $120,000 a year" or "90K–110K".
 */
public record SalaryRange(Long min, Long max, String currency) {

    private static final Pattern AMOUNT = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)\\s*([kK])?");

    public static final SalaryRange NONE = new SalaryRange(null, null, null);

    public static SalaryRange parse(String text) {
        if (text == null || text.isBlank()) {
            return NONE;
        }
        List<Long> amounts = new ArrayList<>();
        Matcher m = AMOUNT.matcher(text);
        while (m.find() && amounts.size() < 2) {
            double value = Double.parseDouble(m.group(1).replace(",", ""));
            if (m.group(2) != null) {
                value *= 1000;
            }
            amounts.add(Math.round(value));
        }
        if (amounts.isEmpty()) {
            return new SalaryRange(null, null, currencyOf(text));
        }
        Long min = amounts.get(0);
        Long max = amounts.size() > 1 ? amounts.get(1) : null;
        return new SalaryRange(min, max, currencyOf(text));
    }

    static String currencyOf(String text) {
        if (text.contains("$")) return "USD";
        if (text.contains("£")) return "GBP";
        if (text.contains("€")) return "EUR";
        if (text.toUpperCase().contains("KES") || text.contains("KSh")) return "KES";
        return null;
    }

    public boolean isEmpty() {
        return min == null && max == null;
    }
}

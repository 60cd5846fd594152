package com.document.intelligence.service;

import com.document.intelligence.model.ValueType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed value strategies: turns recognized text into the canonical string form
 * of a field's value type. Empty when the text does not parse as that type.
 */
@Component
@Slf4j
public class FieldValueParser {

    private static final Pattern AMOUNT = Pattern.compile("\\(?-?\\d[\\d.,']*\\d\\)?|\\(?-?\\d\\)?");
    private static final Pattern DATE_TOKEN = Pattern.compile(
            "\\d{4}-\\d{1,2}-\\d{1,2}|\\d{1,2}[./-]\\d{1,2}[./-]\\d{2,4}|\\d{1,2} [A-Za-z]{3,9}\\.? \\d{4}|[A-Za-z]{3,9}\\.? \\d{1,2},? \\d{4}");

    // slashed dates read month first; day first only when the month would be out of range
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-M-d", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d/M/yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d.M.yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d-M-yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M/d/yy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d/M/yy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMMM d yyyy", Locale.ENGLISH));

    public Optional<String> parse(String raw, ValueType type) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return switch (type) {
                case TEXT       -> text(raw);
                case INTEGER    -> integer(raw);
                case AMOUNT     -> amount(raw).map(BigDecimal::toPlainString);
                case DATE       -> date(raw).map(LocalDate::toString);
                case LINE_ITEMS -> lineItems(raw);
            };
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Failed to parse '{}' as {}", raw, type);
            return Optional.empty();
        }
    }

    private Optional<String> text(String raw) {
        String collapsed = raw.replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? Optional.empty() : Optional.of(collapsed);
    }

    private Optional<String> integer(String raw) {
        String digits = raw.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) return Optional.empty();
        String value = new BigInteger(digits).toString();
        return Optional.of(raw.trim().startsWith("-") ? "-" + value : value);
    }

    /**
     * Last amount-looking token in the text, scale 2. Both "1,234.56" and
     * "1.234,56" read as 1234.56: when both separators occur the later one is
     * the decimal mark; a lone separator is decimal only with 1-2 digits after it.
     */
    Optional<BigDecimal> amount(String raw) {
        Matcher m = AMOUNT.matcher(raw);
        String token = null;
        while (m.find()) token = m.group();
        if (token == null) return Optional.empty();

        boolean negative = token.startsWith("(") && token.endsWith(")") || token.replace("(", "").startsWith("-");
        String digits = token.replaceAll("[()\\-']", "");

        int lastDot = digits.lastIndexOf('.');
        int lastComma = digits.lastIndexOf(',');
        String normalized;
        if (lastDot >= 0 && lastComma >= 0) {
            char decimal = lastDot > lastComma ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            normalized = digits.replace(String.valueOf(grouping), "").replace(decimal, '.');
        } else if (lastDot >= 0 || lastComma >= 0) {
            char separator = lastDot >= 0 ? '.' : ',';
            int last = Math.max(lastDot, lastComma);
            int decimals = digits.length() - last - 1;
            boolean single = digits.indexOf(separator) == last;
            if (single && decimals >= 1 && decimals <= 2) {
                normalized = digits.replace(separator, '.');
            } else {
                normalized = digits.replace(String.valueOf(separator), "");
            }
        } else {
            normalized = digits;
        }

        BigDecimal value = new BigDecimal(normalized).setScale(2, RoundingMode.HALF_UP);
        return Optional.of(negative ? value.negate() : value);
    }

    Optional<LocalDate> date(String raw) {
        Matcher m = DATE_TOKEN.matcher(raw);
        List<String> candidates = new ArrayList<>();
        while (m.find()) candidates.add(m.group());
        candidates.add(raw.trim());

        for (String candidate : candidates) {
            String cleaned = candidate.matches(".*[A-Za-z].*")
                    ? candidate.replaceAll("[.,]", "").replaceAll("\\s+", " ").trim()
                    : candidate.trim();
            for (DateTimeFormatter format : DATE_FORMATS) {
                try {
                    return Optional.of(LocalDate.parse(cleaned, format));
                } catch (DateTimeParseException ignored) {
                    // next format
                }
            }
        }
        return Optional.empty();
    }

    /**
     * One amount per line that ends in one, joined with ';'.
     */
    private Optional<String> lineItems(String raw) {
        List<String> amounts = new ArrayList<>();
        for (String line : raw.split("\\R")) {
            if (line.isBlank()) continue;
            amount(line).ifPresent(a -> amounts.add(a.toPlainString()));
        }
        return amounts.isEmpty() ? Optional.empty() : Optional.of(String.join(";", amounts));
    }
}

package com.schedq.util;

import com.schedq.exception.InvalidCronExpressionException;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates five-field cron expressions ({@code minute hour day-of-month month day-of-week}) and evaluates
 * their next fire time.
 * <p>
 * Each field is {@code *}, a bounded integer, or {@code *}{@code /step}. Evaluation delegates to Spring's
 * {@link CronExpression} with a zero seconds field prepended.
 */
public final class CronValidator {

    public static final int MIN_LENGTH = 9;
    public static final int MAX_LENGTH = 100;

    private static final Pattern NUMBER = Pattern.compile("\\d{1,2}");
    private static final Pattern STEP = Pattern.compile("\\*/(\\d{1,2})");

    private static final List<Field> FIELDS = List.of(
            new Field("minute", 0, 59),
            new Field("hour", 0, 23),
            new Field("day-of-month", 1, 31),
            new Field("month", 1, 12),
            new Field("day-of-week", 0, 6));

    private CronValidator() {
    }

    public static boolean isValid(String expression) {
        try {
            validate(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    public static void validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression must not be blank");
        }
        String trimmed = expression.trim();
        if (trimmed.length() < MIN_LENGTH || trimmed.length() > MAX_LENGTH) {
            throw new InvalidCronExpressionException(expression,
                    "length must be between " + MIN_LENGTH + " and " + MAX_LENGTH + " characters");
        }
        String[] parts = trimmed.split("\\s+");
        if (parts.length != FIELDS.size()) {
            throw new InvalidCronExpressionException(expression,
                    "expected 5 fields but found " + parts.length);
        }
        for (int i = 0; i < parts.length; i++) {
            validateField(expression, FIELDS.get(i), parts[i]);
        }
    }

    /**
     * Next fire time strictly after {@code after}, evaluated in {@code zone}. Returns {@code null} when the
     * expression never fires again.
     */
    public static OffsetDateTime nextExecution(String expression, ZoneId zone, OffsetDateTime after) {
        validate(expression);
        CronExpression cron = CronExpression.parse("0 " + expression.trim());
        ZonedDateTime next = cron.next(after.atZoneSameInstant(zone));
        return next == null ? null : next.toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
    }

    public static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }
    }

    private static void validateField(String expression, Field field, String token) {
        if ("*".equals(token)) {
            return;
        }
        Matcher step = STEP.matcher(token);
        if (step.matches()) {
            int value = Integer.parseInt(step.group(1));
            if (value < 1 || value > field.max()) {
                throw new InvalidCronExpressionException(expression,
                        field.name() + " step must be between 1 and " + field.max() + " but was " + value);
            }
            return;
        }
        if (NUMBER.matcher(token).matches()) {
            int value = Integer.parseInt(token);
            if (value < field.min() || value > field.max()) {
                throw new InvalidCronExpressionException(expression,
                        field.name() + " must be between " + field.min() + " and " + field.max() + " but was " + value);
            }
            return;
        }
        throw new InvalidCronExpressionException(expression,
                "unsupported " + field.name() + " value '" + token + "'");
    }

    private record Field(String name, int min, int max) {
    }
}

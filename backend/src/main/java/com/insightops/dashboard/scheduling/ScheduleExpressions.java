package com.insightops.dashboard.scheduling;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;

/**
 * Validation and normalization of cron schedule expressions.
 *
 * <p>Both the classic 5-field form (minute precision) and a 6-field form whose
 * first field is seconds are accepted. 5-field expressions are run at second 0.</p>
 */
public final class ScheduleExpressions {

    private ScheduleExpressions() {
    }

    /**
     * Converts the expression to Spring's 6-field cron syntax.
     *
     * @throws IllegalArgumentException if the expression is blank or has a field count other than 5 or 6
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Schedule expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        String joined = String.join(" ", fields);
        if (fields.length == 5) {
            return "0 " + joined;
        }
        if (fields.length == 6) {
            return joined;
        }
        throw new IllegalArgumentException(
                "Schedule expression must have 5 or 6 fields but has " + fields.length + ": " + expression);
    }

    public static boolean isValid(String expression) {
        try {
            return CronExpression.isValidExpression(normalize(expression));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException if the expression is not valid
     */
    public static CronTrigger toTrigger(String expression, ZoneId zone) {
        return new CronTrigger(normalize(expression), zone);
    }
}

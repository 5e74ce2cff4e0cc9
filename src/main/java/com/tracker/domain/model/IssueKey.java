package com.tracker.domain.model;

import com.tracker.domain.error.ValidationError.IssueKeyError;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human-readable entity key such as {@code TASK-42}.
 */
public record IssueKey(String prefix, long number) {

    private static final Pattern PREFIX = Pattern.compile("[A-Z][A-Z0-9]{0,9}");
    private static final Pattern KEY = Pattern.compile("([A-Z][A-Z0-9]{0,9})-([1-9][0-9]*)");

    public IssueKey {
        requireValidPrefix(prefix);
        if (number < 1) {
            throw new IllegalArgumentException("Issue key number must be positive: " + number);
        }
    }

    public static IssueKey of(String prefix, long number) {
        return new IssueKey(prefix, number);
    }

    /**
     * Parses a key string, returning a Result for malformed input.
     */
    public static Result<IssueKey, IssueKeyError> parse(String value) {
        if (value == null) {
            return Result.failure(new IssueKeyError.InvalidFormat(null));
        }
        Matcher matcher = KEY.matcher(value.trim());
        if (!matcher.matches()) {
            return Result.failure(new IssueKeyError.InvalidFormat(value));
        }
        try {
            return Result.success(new IssueKey(matcher.group(1), Long.parseLong(matcher.group(2))));
        } catch (NumberFormatException e) {
            return Result.failure(new IssueKeyError.InvalidFormat(value));
        }
    }

    public static void requireValidPrefix(String prefix) {
        if (prefix == null || !PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException(
                "Key prefix must be 1-10 upper-case letters or digits starting with a letter: " + prefix);
        }
    }

    public String format() {
        return prefix + "-" + number;
    }

    @Override
    public String toString() {
        return format();
    }
}

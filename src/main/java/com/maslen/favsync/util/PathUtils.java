package com.maslen.favsync.util;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path helpers for external tools and download destinations.
 */
@Slf4j
public final class PathUtils {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");

    private static final Map<String, DateTimeFormatter> DATE_PLACEHOLDERS = Map.of(
            "YYYY", DateTimeFormatter.ofPattern("yyyy"),
            "YY", DateTimeFormatter.ofPattern("yy"),
            "MM", DateTimeFormatter.ofPattern("MM"),
            "DD", DateTimeFormatter.ofPattern("dd"),
            "HH", DateTimeFormatter.ofPattern("HH"),
            "mm", DateTimeFormatter.ofPattern("mm"),
            "SS", DateTimeFormatter.ofPattern("ss"));

    private PathUtils() {
        // Utility class
    }

    /**
     * Resolves the path of an external tool:
     * <ul>
     * <li>{@code configured} empty or null: {@code defaultValue} (a command on PATH)</li>
     * <li>{@code configured} relative: made absolute against the working directory</li>
     * <li>{@code configured} absolute: normalized</li>
     * </ul>
     */
    public static String resolvePath(String configured, String defaultValue) {
        if (configured == null || configured.isEmpty()) {
            return defaultValue;
        }
        if (Paths.get(configured).isAbsolute()) {
            return Paths.get(configured).normalize().toString();
        }
        return Paths.get(configured).toAbsolutePath().normalize().toString();
    }

    /**
     * Substitutes {@code {YYYY}}, {@code {YY}}, {@code {MM}}, {@code {DD}}, {@code {HH}},
     * {@code {mm}} and {@code {SS}} in a destination template. A template with any
     * other placeholder is used literally.
     */
    public static Path formatDownloadPath(String template, LocalDateTime now) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder formatted = new StringBuilder();
        while (matcher.find()) {
            DateTimeFormatter formatter = DATE_PLACEHOLDERS.get(matcher.group(1));
            if (formatter == null) {
                log.warn("Unknown format variable '{}' in path {}, using original path", matcher.group(1), template);
                return Paths.get(template);
            }
            matcher.appendReplacement(formatted, Matcher.quoteReplacement(now.format(formatter)));
        }
        matcher.appendTail(formatted);
        return Paths.get(formatted.toString());
    }
}

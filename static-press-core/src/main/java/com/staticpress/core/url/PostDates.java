package com.staticpress.core.url;

import com.staticpress.core.util.FileUtils;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date handling for post file names.
 *
 * <p>A post's only source of chronology is the {@code yyyy-MM-dd} token at the start of its
 * file name. All formatting uses {@link Locale#ENGLISH} and UTC.
 */
public final class PostDates {

    /** RFC-822 style date used by RSS {@code pubDate}. */
    public static final DateTimeFormatter RFC_822 =
        DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss Z", Locale.ENGLISH);

    /** Date shown under a post title in listings. */
    public static final DateTimeFormatter SNIPPET =
        DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    /** Heading of a monthly archive entry. */
    public static final DateTimeFormatter MONTH_HEADING =
        DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private static final Pattern DATE_TOKEN = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern MONTH_KEY = Pattern.compile("^(\\d{4})-(\\d{2})$");

    private PostDates() {
        // Utility class
    }

    /**
     * Extracts the {@code yyyy-MM-dd} token from a post path.
     *
     * @param path post file
     * @return date token
     * @throws DateParseException if the base name does not start with a date token
     */
    public static String dateToken(Path path) {
        return parse(path).toString();
    }

    /**
     * Parses the date token of a post path.
     *
     * @param path post file
     * @return publication date
     * @throws DateParseException if the base name does not start with a valid date
     */
    public static LocalDate parse(Path path) {
        String baseName = FileUtils.getBaseName(path);
        Matcher matcher = DATE_TOKEN.matcher(baseName);
        if (!matcher.find()) {
            throw new DateParseException(path, "no date token");
        }
        try {
            return LocalDate.of(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
        } catch (DateTimeException e) {
            throw new DateParseException(path, "invalid date " + matcher.group(), e);
        }
    }

    /**
     * Returns the {@code yyyy-MM} month key of a post.
     *
     * @param path post file
     * @return month key
     * @throws DateParseException if the base name does not start with a valid date
     */
    public static String monthKey(Path path) {
        return dateToken(path).substring(0, 7);
    }

    /**
     * Formats a post's date for RSS, at midnight UTC.
     *
     * @param path post file
     * @return RFC-822 date, e.g. {@code Mon, 2 Jan 2023 00:00:00 +0000}
     */
    public static String rfc822(Path path) {
        return parse(path).atStartOfDay(ZoneOffset.UTC).format(RFC_822);
    }

    /**
     * Formats a post's date for listings.
     *
     * @param path post file
     * @return date such as {@code 02 Jan 2023}
     */
    public static String snippetDate(Path path) {
        return parse(path).format(SNIPPET);
    }

    /**
     * Formats a month key for archive headings.
     *
     * @param monthKey {@code yyyy-MM}
     * @return heading such as {@code January 2023}
     * @throws IllegalArgumentException if the key is not a valid month
     */
    public static String monthHeading(String monthKey) {
        if (!MONTH_KEY.matcher(monthKey).matches()) {
            throw new IllegalArgumentException("Not a yyyy-MM month key: " + monthKey);
        }
        try {
            return YearMonth.parse(monthKey).format(MONTH_HEADING);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a yyyy-MM month key: " + monthKey, e);
        }
    }
}

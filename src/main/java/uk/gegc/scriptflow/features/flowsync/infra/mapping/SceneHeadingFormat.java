package uk.gegc.scriptflow.features.flowsync.infra.mapping;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and rebuilds scene heading lines such as {@code INT. TAVERN - NIGHT}.
 */
public final class SceneHeadingFormat {

    public static final String INT = "int";
    public static final String EXT = "ext";
    public static final String INT_EXT = "int_ext";

    public static final String DEFAULT_HEADING = "INT. - DAY";

    private static final Pattern INT_EXT_PREFIX =
            Pattern.compile("^(?:INT\\.?\\s*/\\s*EXT|I\\s*/\\s*E)(?:\\.\\s*|\\s+|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXT_PREFIX = Pattern.compile("^EXT(?:\\.\\s*|\\s+|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern INT_PREFIX = Pattern.compile("^INT(?:\\.\\s*|\\s+|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_SEPARATOR = Pattern.compile("(?:^|\\s+)-\\s+");

    private SceneHeadingFormat() {
    }

    public record SceneHeading(String intExt, String description, String timeOfDay) {
    }

    public static SceneHeading parse(String content) {
        String text = content == null ? "" : content.trim();

        String intExt = INT;
        String rest = text;
        for (PrefixRule rule : PrefixRule.values()) {
            Matcher matcher = rule.pattern.matcher(text);
            if (matcher.find()) {
                intExt = rule.intExt;
                rest = text.substring(matcher.end());
                break;
            }
        }

        String[] parts = TIME_SEPARATOR.split(rest, 2);
        String description = parts[0].trim();
        String timeOfDay = parts.length > 1 ? parts[1].trim() : "";
        return new SceneHeading(intExt, description, timeOfDay);
    }

    public static String format(String intExt, String description, String timeOfDay) {
        StringBuilder heading = new StringBuilder(prefixFor(intExt));
        if (description != null && !description.isBlank()) {
            heading.append(' ').append(description.trim());
        }
        if (timeOfDay != null && !timeOfDay.isBlank()) {
            heading.append(" - ").append(timeOfDay.trim());
        }
        return heading.toString();
    }

    private static String prefixFor(String intExt) {
        if (EXT.equals(intExt)) {
            return "EXT.";
        }
        if (INT_EXT.equals(intExt)) {
            return "INT./EXT.";
        }
        return "INT.";
    }

    // Checked in declaration order, so the combined prefix wins over INT.
    private enum PrefixRule {
        COMBINED(INT_EXT_PREFIX, INT_EXT),
        EXTERIOR(EXT_PREFIX, EXT),
        INTERIOR(INT_PREFIX, INT);

        private final Pattern pattern;
        private final String intExt;

        PrefixRule(Pattern pattern, String intExt) {
            this.pattern = pattern;
            this.intExt = intExt;
        }
    }
}

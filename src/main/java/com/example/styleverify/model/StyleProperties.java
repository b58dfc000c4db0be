package com.example.styleverify.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Canonical, immutable set of formatting properties.
 * <p>
 * Keys are folded to a fixed vocabulary ({@code FontFamily}, {@code font-family} and
 * {@code font_family} all become {@code fontFamily}) and values to a canonical text form.
 * Properties holding their default value are dropped, so an explicit default and an
 * omitted property compare equal.
 */
public final class StyleProperties {

    public static final String FONT_FAMILY = "fontFamily";
    public static final String FONT_SIZE = "fontSize";
    public static final String BOLD = "bold";
    public static final String ITALIC = "italic";
    public static final String UNDERLINE = "underline";
    public static final String COLOR = "color";
    public static final String ALIGNMENT = "alignment";
    public static final String STYLE_TYPE = "styleType";

    private static final Set<String> BOOLEAN_KEYS = Set.of(
            BOLD, ITALIC, UNDERLINE, "strikethrough", "allCaps", "smallCaps", "shadow", "outline",
            "keepWithNext", "keepTogether", "widowOrphanControl");

    private static final Set<String> NUMBER_KEYS = Set.of(
            FONT_SIZE, "characterSpacing", "spacingBefore", "spacingAfter",
            "indentationLeft", "indentationRight", "firstLineIndent", "lineSpacing");

    private static final Set<String> ENUM_KEYS = Set.of(ALIGNMENT, STYLE_TYPE, "highlighting", "verticalAlignment");

    /** Folded lookup form (lower case, no separators) → canonical key. */
    private static final Map<String, String> KEY_ALIASES;

    static {
        Map<String, String> aliases = new TreeMap<>();
        for (String key : new String[]{FONT_FAMILY, FONT_SIZE, BOLD, ITALIC, UNDERLINE, COLOR, ALIGNMENT,
                STYLE_TYPE, "strikethrough", "allCaps", "smallCaps", "shadow", "outline", "highlighting",
                "characterSpacing", "language", "spacingBefore", "spacingAfter", "indentationLeft",
                "indentationRight", "firstLineIndent", "lineSpacing", "basedOnStyle", "keepWithNext",
                "keepTogether", "widowOrphanControl", "verticalAlignment"}) {
            aliases.put(fold(key), key);
        }
        aliases.put("font", FONT_FAMILY);
        aliases.put("fontname", FONT_FAMILY);
        aliases.put("size", FONT_SIZE);
        aliases.put("fontcolor", COLOR);
        aliases.put("justification", ALIGNMENT);
        aliases.put("isbold", BOLD);
        aliases.put("isitalic", ITALIC);
        aliases.put("isunderline", UNDERLINE);
        aliases.put("isstrikethrough", "strikethrough");
        aliases.put("isallcaps", "allCaps");
        aliases.put("issmallcaps", "smallCaps");
        aliases.put("hasshadow", "shadow");
        aliases.put("hasoutline", "outline");
        aliases.put("basedon", "basedOnStyle");
        KEY_ALIASES = Collections.unmodifiableMap(aliases);
    }

    private static final Pattern HEX6 = Pattern.compile("[0-9a-fA-F]{6}");
    private static final Pattern HEX3 = Pattern.compile("[0-9a-fA-F]{3}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final StyleProperties EMPTY = new StyleProperties(new TreeMap<>());

    private final SortedMap<String, String> values;

    private StyleProperties(SortedMap<String, String> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static StyleProperties empty() {
        return EMPTY;
    }

    /**
     * Builds canonical properties from a raw bag. Null keys are ignored; when two raw keys fold to
     * the same canonical key, the lexicographically greatest raw key wins so the outcome does not
     * depend on map iteration order.
     */
    public static StyleProperties of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        SortedMap<String, String> canonical = new TreeMap<>();
        SortedMap<String, String> sourceKeys = new TreeMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) continue;
            String key = canonicalKey(entry.getKey());
            String previousSource = sourceKeys.get(key);
            if (previousSource != null && previousSource.compareTo(entry.getKey()) > 0) continue;
            sourceKeys.put(key, entry.getKey());
            String value = canonicalValue(key, entry.getValue());
            if (value == null) {
                canonical.remove(key);
            } else {
                canonical.put(key, value);
            }
        }
        return canonical.isEmpty() ? EMPTY : new StyleProperties(canonical);
    }

    /** Returns a copy with {@code key} set to {@code value} (or removed if the value is a default). */
    public StyleProperties with(String key, Object value) {
        String canonicalKey = canonicalKey(key);
        String canonicalValue = canonicalValue(canonicalKey, value);
        SortedMap<String, String> copy = new TreeMap<>(values);
        if (canonicalValue == null) {
            copy.remove(canonicalKey);
        } else {
            copy.put(canonicalKey, canonicalValue);
        }
        return copy.isEmpty() ? EMPTY : new StyleProperties(copy);
    }

    public String get(String key) {
        return values.get(canonicalKey(key));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /** Sorted, unmodifiable view of the canonical properties. */
    public SortedMap<String, String> asMap() {
        return values;
    }

    /** Keys whose canonical value differs between this set and {@code other}, absence included. */
    public SortedSet<String> differingKeys(StyleProperties other) {
        SortedSet<String> keys = new TreeSet<>(values.keySet());
        keys.addAll(other.values.keySet());
        keys.removeIf(key -> Objects.equals(values.get(key), other.values.get(key)));
        return keys;
    }

    public static String canonicalKey(String rawKey) {
        String folded = fold(rawKey);
        return KEY_ALIASES.getOrDefault(folded, folded);
    }

    /**
     * Canonical value text, or {@code null} when the value is absent or equals the property default.
     */
    static String canonicalValue(String key, Object raw) {
        if (raw == null) return null;
        String text = WHITESPACE.matcher(raw.toString().trim()).replaceAll(" ");
        if (text.isEmpty()) return null;

        if (BOOLEAN_KEYS.contains(key)) {
            String bool = canonicalBoolean(text);
            return "false".equals(bool) ? null : bool;
        }
        if (NUMBER_KEYS.contains(key)) {
            String number = canonicalNumber(text);
            if ("lineSpacing".equals(key)) {
                return "1".equals(number) ? null : number;
            }
            return "0".equals(number) ? null : number;
        }
        if (COLOR.equals(key)) {
            return canonicalColor(text);
        }
        if (ENUM_KEYS.contains(key)) {
            String value = text.toLowerCase(Locale.ROOT);
            if (ALIGNMENT.equals(key)) {
                value = canonicalAlignment(value);
                return "left".equals(value) ? null : value;
            }
            if ("highlighting".equals(key) && "none".equals(value)) return null;
            return value;
        }
        return text;
    }

    public static String canonicalNumber(String text) {
        try {
            BigDecimal number = new BigDecimal(text.trim());
            if (number.signum() == 0) return "0";
            return number.stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return text.trim().toLowerCase(Locale.ROOT);
        }
    }

    private static String canonicalBoolean(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> "true";
            case "false", "0", "no", "off" -> "false";
            default -> text.toLowerCase(Locale.ROOT);
        };
    }

    private static String canonicalColor(String text) {
        String value = text.startsWith("#") ? text.substring(1) : text;
        if (HEX6.matcher(value).matches()) {
            return "#" + value.toUpperCase(Locale.ROOT);
        }
        if (HEX3.matcher(value).matches()) {
            StringBuilder expanded = new StringBuilder("#");
            for (char c : value.toUpperCase(Locale.ROOT).toCharArray()) {
                expanded.append(c).append(c);
            }
            return expanded.toString();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return "auto".equals(lower) ? null : lower;
    }

    private static String canonicalAlignment(String value) {
        return switch (value) {
            case "both", "justified", "distribute" -> "justify";
            case "centre", "centered", "centred" -> "center";
            case "start" -> "left";
            case "end" -> "right";
            default -> value;
        };
    }

    private static String fold(String rawKey) {
        return rawKey.trim().replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StyleProperties other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

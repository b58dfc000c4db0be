package com.example.styleverify.model;

import java.util.Locale;

/**
 * One tab position of a style. Tab stops form an ordered sequence per style.
 *
 * @param position  position in twentieths of a point (null when the extractor does not report it)
 * @param alignment left, center, right, decimal or bar
 * @param leader    leader character (none, dot, hyphen, underscore, heavy, middleDot)
 */
public record TabStop(Double position, String alignment, String leader) {

    /** Canonical {@code alignment/leader@position} descriptor used for comparison and reporting. */
    public String describe() {
        String pos = position == null ? "" : "@" + StyleProperties.canonicalNumber(position.toString());
        return canonicalAlignment() + "/" + canonicalLeader() + pos;
    }

    /**
     * Same alignment and leader; positions are compared only when both stops report one.
     */
    public boolean matches(TabStop other) {
        if (!canonicalAlignment().equals(other.canonicalAlignment())
                || !canonicalLeader().equals(other.canonicalLeader())) {
            return false;
        }
        if (position == null || other.position == null) return true;
        return StyleProperties.canonicalNumber(position.toString())
                .equals(StyleProperties.canonicalNumber(other.position.toString()));
    }

    public String canonicalAlignment() {
        if (alignment == null || alignment.isBlank()) return "left";
        String value = alignment.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "start" -> "left";
            case "end" -> "right";
            case "centre" -> "center";
            default -> value;
        };
    }

    public String canonicalLeader() {
        if (leader == null || leader.isBlank()) return "none";
        String value = leader.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "dots" -> "dot";
            case "dashes", "dash" -> "hyphen";
            case "lines", "line", "underline" -> "underscore";
            case "middledot" -> "middledot";
            default -> value;
        };
    }
}

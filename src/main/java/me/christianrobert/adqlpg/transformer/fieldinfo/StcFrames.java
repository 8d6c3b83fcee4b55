package me.christianrobert.adqlpg.transformer.fieldinfo;

import java.util.Locale;
import java.util.Set;

/**
 * Coordinate frame names as used in ADQL geometry literals and STC-S, and the
 * rules for combining them.
 */
public final class StcFrames {

    /** Marker for a value whose operands had conflicting frames. */
    public static final String BROKEN = "BROKEN";

    public static final String UNKNOWN = "UNKNOWN";

    /** Frames we know how to name in a TAP context. */
    public static final Set<String> TAP_SYSTEMS = Set.of(
            "ICRS", "FK4", "FK5", "GALACTIC", "ECLIPTIC", "RELOCATABLE", UNKNOWN, "");

    /** Frames that can be combined with any other frame without a warning. */
    private static final Set<String> UNIVERSALLY_COMPATIBLE = Set.of(
            UNKNOWN, "", "RELOCATABLE", BROKEN);

    private StcFrames() {
        // Static utility class - prevent instantiation
    }

    /**
     * Extracts the frame from a coordinate system literal such as {@code 'ICRS GEOCENTER'}.
     * Only the first word counts; it is upper-cased. An empty literal yields the empty frame.
     */
    public static String fromCoordSys(String literal) {
        if (literal == null) {
            return null;
        }
        String trimmed = literal.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String first = trimmed.split("\\s+")[0].toUpperCase(Locale.ROOT);
        if ("UNKNOWNFRAME".equals(first)) {
            return UNKNOWN;
        }
        return first;
    }

    public static boolean isUniversallyCompatible(String frame) {
        return frame == null || UNIVERSALLY_COMPATIBLE.contains(frame);
    }

    /**
     * Two frames are compatible if they are equal or at least one of them carries
     * no concrete frame.
     */
    public static boolean isCompatible(String frame1, String frame2) {
        if (isUniversallyCompatible(frame1) || isUniversallyCompatible(frame2)) {
            return true;
        }
        return frame1.equals(frame2);
    }

    /**
     * Frame of a value computed from two operands. A missing frame yields the other
     * operand's frame; two differing concrete frames yield {@link #BROKEN}.
     */
    public static String combine(String frame1, String frame2) {
        if (frame1 == null) {
            return frame2;
        }
        if (frame2 == null || frame1.equals(frame2)) {
            return frame1;
        }
        if (isUniversallyCompatible(frame1) && !BROKEN.equals(frame1)) {
            return frame2;
        }
        if (isUniversallyCompatible(frame2) && !BROKEN.equals(frame2)) {
            return frame1;
        }
        return BROKEN;
    }
}

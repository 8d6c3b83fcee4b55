package me.christianrobert.adqlpg.transformer.fieldinfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Metadata inferred for an expression: unit, UCD, coordinate frame (STC) and
 * whether the value was derived from its source columns in a way that may
 * invalidate their metadata ("tainted").
 * <p>
 * The user data holds the identities of the upstream columns that contributed
 * to the value. It is opaque to the annotator and simply concatenated when
 * expressions are combined.
 * </p>
 * <p>
 * Instances are immutable; the {@code with...} methods return copies.
 * </p>
 */
public class FieldInfo {

    public static final FieldInfo DIMENSIONLESS = new FieldInfo("", "", null, false, List.of());

    private final String unit;
    private final String ucd;
    private final String stc;
    private final boolean tainted;
    private final List<String> userData;

    public FieldInfo(String unit, String ucd, String stc, boolean tainted, List<String> userData) {
        this.unit = unit == null ? "" : unit;
        this.ucd = ucd == null ? "" : ucd;
        this.stc = stc;
        this.tainted = tainted;
        this.userData = userData == null ? List.of() : List.copyOf(userData);
    }

    public static FieldInfo of(String unit, String ucd) {
        return new FieldInfo(unit, ucd, null, false, List.of());
    }

    /**
     * Metadata of a catalog column; the column identity becomes the user data.
     */
    public static FieldInfo forColumn(String unit, String ucd, String stc, String columnId) {
        return new FieldInfo(unit, ucd, stc, false, columnId == null ? List.of() : List.of(columnId));
    }

    public String getUnit() {
        return unit;
    }

    public String getUcd() {
        return ucd;
    }

    /**
     * Coordinate frame name (e.g. ICRS), {@link StcFrames#BROKEN} after a conflicting
     * combination, or null when the value carries no STC information.
     */
    public String getStc() {
        return stc;
    }

    public boolean isTainted() {
        return tainted;
    }

    public List<String> getUserData() {
        return userData;
    }

    public FieldInfo withUcd(String newUcd) {
        return new FieldInfo(unit, newUcd, stc, tainted, userData);
    }

    public FieldInfo withTainted(boolean newTainted) {
        return new FieldInfo(unit, ucd, stc, newTainted, userData);
    }

    /**
     * Concatenates the user data of all given infos, in order.
     */
    public static List<String> collectUserData(List<FieldInfo> infos) {
        List<String> result = new ArrayList<>();
        for (FieldInfo info : infos) {
            if (info != null) {
                result.addAll(info.getUserData());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * True if any of the infos is tainted.
     */
    public static boolean anyTainted(List<FieldInfo> infos) {
        for (FieldInfo info : infos) {
            if (info != null && info.isTainted()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldInfo other = (FieldInfo) o;
        return tainted == other.tainted
                && unit.equals(other.unit)
                && ucd.equals(other.ucd)
                && Objects.equals(stc, other.stc)
                && userData.equals(other.userData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, ucd, stc, tainted, userData);
    }

    @Override
    public String toString() {
        return "FieldInfo{unit='" + unit + "', ucd='" + ucd + "'"
                + (stc != null ? ", stc=" + stc : "")
                + (tainted ? ", tainted" : "") + "}";
    }
}

package me.christianrobert.adqlpg.transformer.morph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scratchpad of one morph pass, used by handlers to signal their ancestors.
 * <p>
 * {@code killParentOperator} is set by handlers that turned a CONTAINS or
 * INTERSECTS into a pseudo-boolean; the comparison handler consumes it.
 * </p>
 */
public class MorphState {

    private boolean killParentOperator;
    private final List<String> warnings = new ArrayList<>();

    public void setKillParentOperator(boolean killParentOperator) {
        this.killParentOperator = killParentOperator;
    }

    public boolean isKillParentOperator() {
        return killParentOperator;
    }

    /**
     * Returns the signal and clears it.
     */
    public boolean consumeKillParentOperator() {
        boolean result = killParentOperator;
        killParentOperator = false;
        return result;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}

package org.ancombc.tools.biasmodel;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Key-value report returned by each step of {@link BiasMixtureEMAlgorithm}.
 *
 * @author ancombc-bias-em developers
 */
public final class SubroutineSignal implements Serializable {

    private static final long serialVersionUID = -2170934565230391046L;

    public static final class SubroutineSignalBuilder {

        private final Map<String, Object> result;

        public SubroutineSignalBuilder() {
            result = new HashMap<>();
        }

        public SubroutineSignalBuilder put(final String key, final Object value) {
            result.put(key, value);
            return this;
        }

        public SubroutineSignal build() {
            return new SubroutineSignal(result);
        }
    }

    /* anything the subroutine wishes to communicate */
    private final Map<String, Object> result;

    public SubroutineSignal(final Map<String, Object> result) {
        this.result = new HashMap<>(result);
    }

    public boolean contains(final String key) {
        return result.containsKey(key);
    }

    public double getDouble(final String key) {
        return result.containsKey(key) ? (double) result.get(key) : 0;
    }

    public int getInteger(final String key) {
        return result.containsKey(key) ? (int) result.get(key) : 0;
    }

    public static SubroutineSignalBuilder builder() {
        return new SubroutineSignalBuilder();
    }
}

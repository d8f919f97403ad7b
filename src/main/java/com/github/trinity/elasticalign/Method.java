package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.math.Numerics;

import java.util.Locale;

/**
 * Template statistic: Karcher mean or Karcher median in SRSF space.
 * <p>
 * Each constant supplies the template update rule used by the alignment loop, the way
 * the matching cost combines its data and penalty terms, and the statistic used to
 * anchor a reconstructed template function at the first sample.
 * </p>
 *
 * @author trinity-xai
 */
public enum Method {
    MEAN("mean") {
        @Override
        public TemplateUpdater updater() {
            return new MeanTemplateUpdater();
        }

        @Override
        public double cost(double dataTerm, double penaltyTerm) {
            return dataTerm + penaltyTerm;
        }
    },
    MEDIAN("median") {
        @Override
        public TemplateUpdater updater() {
            return new MedianTemplateUpdater();
        }

        @Override
        public double cost(double dataTerm, double penaltyTerm) {
            return Numerics.sqrtMagnitude(dataTerm) + penaltyTerm;
        }
    };

    private final String label;

    Method(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public abstract TemplateUpdater updater();

    /**
     * Combines the summed SRSF residual and the summed roughness penalty into the
     * round cost.
     */
    public abstract double cost(double dataTerm, double penaltyTerm);

    /**
     * Statistic of the functions' first-sample values used as the integration constant
     * of the template function.
     */
    public double anchor(double[] firstValues) {
        return this == MEAN
            ? Numerics.mean(firstValues)
            : Numerics.median(firstValues);
    }

    /**
     * Resolves a method by name. Any unique, case-insensitive prefix of {@code "mean"} or
     * {@code "median"} is accepted, so {@code "mea"} selects MEAN but {@code "me"} is
     * ambiguous.
     *
     * @throws IllegalArgumentException for a null, empty, unknown or ambiguous name
     */
    public static Method fromName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("invalid method selection: " + name);
        }
        String key = name.toLowerCase(Locale.ROOT);
        Method match = null;
        for (Method m : values()) {
            if (m.label.equals(key)) {
                return m;
            }
            if (m.label.startsWith(key)) {
                if (match != null) {
                    throw new IllegalArgumentException("invalid method selection: " + name);
                }
                match = m;
            }
        }
        if (match == null) {
            throw new IllegalArgumentException("invalid method selection: " + name);
        }
        return match;
    }
}

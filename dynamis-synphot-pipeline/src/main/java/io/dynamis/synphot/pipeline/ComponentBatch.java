package io.dynamis.synphot.pipeline;

import io.dynamis.synphot.api.PhotometryConstants;
import io.dynamis.synphot.api.ShapeMismatchException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Per-object inputs for one source component, all in object order.
 *
 * Arrays are copied on construction and on access, so a batch cannot change
 * after its lengths have been checked. Equality compares array contents.
 *
 * @param sedNames per-object SED names; null or "None" for no emission
 * @param magNorm  normalization magnitude through the reference bandpass
 * @param av       internal extinction Av, or null when not applicable
 * @param redshift per-object redshift, or null when not applicable
 */
public record ComponentBatch(List<String> sedNames, double[] magNorm, double[] av, double[] redshift) {

    public ComponentBatch {
        if (sedNames == null) {
            throw new NullPointerException("sedNames");
        }
        if (magNorm == null) {
            throw new NullPointerException("magNorm");
        }
        ShapeMismatchException.requireLength("magNorm", sedNames.size(), magNorm.length);
        if (av != null) {
            ShapeMismatchException.requireLength("av", sedNames.size(), av.length);
        }
        if (redshift != null) {
            ShapeMismatchException.requireLength("redshift", sedNames.size(), redshift.length);
        }
        sedNames = List.copyOf(sedNames.stream()
            .map(n -> n == null ? PhotometryConstants.NO_SED : n)
            .toList());
        magNorm = magNorm.clone();
        av = av == null ? null : av.clone();
        redshift = redshift == null ? null : redshift.clone();
    }

    /** Batch without extinction or redshift, e.g. for stars. */
    public static ComponentBatch of(List<String> sedNames, double[] magNorm) {
        return new ComponentBatch(sedNames, magNorm, null, null);
    }

    public int objectCount() {
        return sedNames.size();
    }

    @Override
    public double[] magNorm() {
        return magNorm.clone();
    }

    @Override
    public double[] av() {
        return av == null ? null : av.clone();
    }

    @Override
    public double[] redshift() {
        return redshift == null ? null : redshift.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ComponentBatch)) {
            return false;
        }
        ComponentBatch other = (ComponentBatch) obj;
        return sedNames.equals(other.sedNames)
            && Arrays.equals(magNorm, other.magNorm)
            && Arrays.equals(av, other.av)
            && Arrays.equals(redshift, other.redshift);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sedNames, Arrays.hashCode(magNorm), Arrays.hashCode(av),
            Arrays.hashCode(redshift));
    }

    @Override
    public String toString() {
        return "ComponentBatch{objects=" + sedNames.size()
            + ", av=" + (av != null) + ", redshift=" + (redshift != null) + "}";
    }
}

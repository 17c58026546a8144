package guraa.doccompare.model;

import guraa.doccompare.visual.PerceptualHashCalculator;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.awt.image.BufferedImage;

/**
 * An image embedded in a page.
 * The fingerprint is either supplied by the extractor or computed from the pixels the first
 * time it is requested; either way it is cached on this instance and never changes.
 */
@Getter
@ToString(of = {"name", "bounds"})
public class EmbeddedImage {

    /**
     * Name given by the extractor (e.g. p1_img2.png).
     */
    private final String name;

    /**
     * The decoded pixels, or null when only a fingerprint is available.
     */
    private final BufferedImage pixels;

    /**
     * Where the image sits on its page.
     */
    private final BoundingBox bounds;

    /**
     * Fingerprint computed by the extractor, if any.
     */
    private final Fingerprint precomputedFingerprint;

    @Getter(lazy = true)
    private final Fingerprint fingerprint = resolveFingerprint();

    @Builder
    public EmbeddedImage(String name, BufferedImage pixels, BoundingBox bounds, Fingerprint precomputedFingerprint) {
        this.name = name;
        this.pixels = pixels;
        this.bounds = bounds;
        this.precomputedFingerprint = precomputedFingerprint;
    }

    public static EmbeddedImage withFingerprint(String name, Fingerprint fingerprint, BoundingBox bounds) {
        return new EmbeddedImage(name, null, bounds, fingerprint);
    }

    public static EmbeddedImage withPixels(String name, BufferedImage pixels, BoundingBox bounds) {
        return new EmbeddedImage(name, pixels, bounds, null);
    }

    /**
     * True when a fingerprint was supplied or can be computed from the pixels.
     * Does not compute the fingerprint.
     */
    public boolean isFingerprintable() {
        return precomputedFingerprint != null || pixels != null;
    }

    private Fingerprint resolveFingerprint() {
        if (precomputedFingerprint != null) {
            return precomputedFingerprint;
        }
        if (pixels == null) {
            return null;
        }
        return PerceptualHashCalculator.compute(pixels);
    }
}

package com.pdftranslator.backend.services.extraction;

/**
 * Axis-aligned box in PDF points, origin at the top-left corner of the page's crop box with y
 * growing downwards.
 */
public record BoundingBox(float x, float y, float width, float height) {

    public BoundingBox {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative box size: " + width + "x" + height);
        }
    }

    public static BoundingBox fromCorners(float x0, float y0, float x1, float y1) {
        float left = Math.min(x0, x1);
        float top = Math.min(y0, y1);
        return new BoundingBox(left, top, Math.abs(x1 - x0), Math.abs(y1 - y0));
    }

    public float right() {
        return x + width;
    }

    public float bottom() {
        return y + height;
    }

    public BoundingBox union(BoundingBox other) {
        return fromCorners(
                Math.min(x, other.x),
                Math.min(y, other.y),
                Math.max(right(), other.right()),
                Math.max(bottom(), other.bottom())
        );
    }

    /**
     * Same box clamped to a page of the given size.
     */
    public BoundingBox clampTo(float pageWidth, float pageHeight) {
        float x0 = clamp(x, pageWidth);
        float y0 = clamp(y, pageHeight);
        float x1 = clamp(right(), pageWidth);
        float y1 = clamp(bottom(), pageHeight);
        return fromCorners(x0, y0, x1, y1);
    }

    private static float clamp(float v, float max) {
        return Math.max(0f, Math.min(max, v));
    }
}

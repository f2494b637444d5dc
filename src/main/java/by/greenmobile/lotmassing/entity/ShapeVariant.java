package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.Locale;

/**
 * Вариант формы: доля ширины крыла (shape_ratio) и ориентация (градусы).
 * ORTHOGONAL = форма без маски (тождественный вариант).
 */
@Value
public class ShapeVariant {

    public static final ShapeVariant ORTHOGONAL = new ShapeVariant(1.0, 0.0, false);

    double shapeRatio;
    double orientation;
    boolean composite;

    public static ShapeVariant lShape(double ratio, double orientation) {
        return new ShapeVariant(ratio, orientation, true);
    }

    @JsonIgnore
    public String getId() {
        if (!composite) return "ORTHOGONAL";
        return String.format(Locale.US, "L-R%.2f-O%.0f", shapeRatio, orientation);
    }

    @Override
    public String toString() {
        return getId();
    }
}

package by.greenmobile.lotmassing.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;

/**
 * Один надземный этаж массы.
 *
 * ВАЖНО: footprint не сериализуется в JSON напрямую (JTS), наружу уходит WKT.
 */
@Value
@Builder
public class FloorRecord {

    /** 1 = первый (наземный) этаж. */
    int floorIndex;
    String label;

    double baseElevation;
    double floorHeight;

    @JsonIgnore
    Geometry footprint;

    double footprintArea;
    double coreArea;
    double circulationArea;
    double usableArea;

    double frontSetback;
    double backSetback;
    double sideSetback;

    /** Отступы реально изменили контур относительно границы участка. */
    boolean hasSetback;
    /** Задний отступ вырос с высотой (больше минимального). */
    boolean verticalSetback;

    /** Вариант формы; null для базового (baseline) стека. */
    ShapeVariant variant;

    public double getTopElevation() {
        return baseElevation + floorHeight;
    }

    public String getFootprintWkt() {
        return footprint == null ? null : new WKTWriter().write(footprint);
    }

    public static String labelFor(int floorIndex) {
        return floorIndex == 1 ? "Ground" : "Floor " + floorIndex;
    }
}

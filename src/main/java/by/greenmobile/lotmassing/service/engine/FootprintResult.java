package by.greenmobile.lotmassing.service.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;

/**
 * Результат генерации пятна: либо принятое пятно с площадями, либо причина отказа.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FootprintResult {

    Geometry footprint;
    double area;
    double coreArea;
    double circulationArea;
    double usableArea;
    boolean hasSetback;

    RejectionReason rejection;
    String detail;

    public static FootprintResult accepted(Geometry footprint, double coreArea, double circulationArea,
                                           double usableArea, boolean hasSetback) {
        return new FootprintResult(footprint, footprint.getArea(), coreArea, circulationArea,
                usableArea, hasSetback, null, null);
    }

    public static FootprintResult rejected(RejectionReason reason, String detail) {
        return new FootprintResult(null, 0, 0, 0, 0, false, reason, detail);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public double getEfficiency() {
        return area > 0 ? usableArea / area : 0.0;
    }
}

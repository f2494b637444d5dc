package by.greenmobile.lotmassing.entity;

import lombok.Value;
import org.locationtech.jts.geom.LineString;

/** Отрезок границы участка с назначенной ролью. */
@Value
public class BoundaryFace {
    FaceRole role;
    LineString segment;
}

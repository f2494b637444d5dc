package by.greenmobile.lotmassing.entity;

import lombok.Value;
import org.locationtech.jts.geom.Polygon;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Участок: простой полигон без дыр + грани границы с ролями.
 *
 * Единицы: метры, м². Создаётся только через LotGeometryFactory (валидация там).
 */
@Value
public class LotGeometry {

    String lotId;

    Polygon polygon;

    List<BoundaryFace> faces;

    public double area() {
        return polygon.getArea();
    }

    public List<BoundaryFace> facesOf(FaceRole role) {
        return faces.stream().filter(f -> f.getRole() == role).collect(Collectors.toList());
    }
}

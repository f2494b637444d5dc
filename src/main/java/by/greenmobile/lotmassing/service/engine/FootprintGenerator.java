package by.greenmobile.lotmassing.service.engine;

import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.SetbackOffsets;
import by.greenmobile.lotmassing.entity.ShapeVariant;
import by.greenmobile.lotmassing.service.geometry.FaceOffsetGeometry;
import by.greenmobile.lotmassing.service.geometry.ShapeMask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static by.greenmobile.lotmassing.service.geometry.FaceOffsetGeometry.SLIVER_AREA;
import static by.greenmobile.lotmassing.service.geometry.FaceOffsetGeometry.largestPolygon;

/**
 * Пятно одного этажа.
 *
 * 1) участок уменьшается на отступы по ролям граней (plain);
 * 2) для составной формы plain пересекается с L-маской. Маска строится по базовому контуру
 *    (участок с минимальными отступами), поэтому одна и та же на всех этажах варианта;
 * 3) проверки по порядку: пусто, min_floor_area, min_unit_width, патио, ядро.
 *
 * ВАЖНО: отказ возвращается как FootprintResult.rejected(...), а не исключением.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FootprintGenerator {

    /** Допуск сравнения площадей с площадью участка, м². */
    static final double AREA_EPS = 1e-6;

    private final FaceOffsetGeometry geometry;
    private final FloorAreaModel areaModel;

    public FootprintResult generate(LotGeometry lot, ParameterSet p, SetbackOffsets offsets, ShapeVariant variant) {
        Geometry plain = geometry.offsetPolygon(lot, offsets);
        if (plain.isEmpty() || plain.getArea() < SLIVER_AREA) {
            return FootprintResult.rejected(RejectionReason.EMPTY, "setbacks consume the lot");
        }

        boolean hasSetback = offsets.anyPositive() && plain.getArea() < lot.area() - AREA_EPS;

        Geometry footprint = plain;
        List<Geometry> parts = List.of(plain);

        if (variant.isComposite()) {
            Geometry base = geometry.offsetPolygon(lot, SetbackOffsets.minimums(p));
            ShapeMask mask = geometry.compositeMask(base, variant);

            footprint = largestPolygon(plain.intersection(mask.getMask()));
            if (footprint.isEmpty() || footprint.getArea() < SLIVER_AREA) {
                return FootprintResult.rejected(RejectionReason.EMPTY, "shape mask does not overlap the offset polygon");
            }

            List<Geometry> wingParts = new ArrayList<>();
            for (Geometry wing : mask.getWings()) {
                Geometry part = largestPolygon(footprint.intersection(wing));
                if (!part.isEmpty() && part.getArea() >= SLIVER_AREA) wingParts.add(part);
            }
            if (!wingParts.isEmpty()) parts = wingParts;
        }

        double area = footprint.getArea();
        if (area < p.getMinFloorArea()) {
            return FootprintResult.rejected(RejectionReason.BELOW_MIN_AREA,
                    String.format(Locale.US, "area %.2f < min_floor_area %.2f", area, p.getMinFloorArea()));
        }

        double minWidth = parts.stream().mapToDouble(geometry::minimumWidth).min().orElse(0.0);
        if (minWidth < p.getMinUnitWidth()) {
            return FootprintResult.rejected(RejectionReason.TOO_NARROW,
                    String.format(Locale.US, "width %.2f < min_unit_width %.2f", minWidth, p.getMinUnitWidth()));
        }

        if (variant.isComposite()) {
            Geometry patio = largestPolygon(plain.difference(footprint));
            if (!patio.isEmpty() && patio.getArea() >= SLIVER_AREA) {
                double patioWidth = geometry.minimumWidth(patio);
                if (patioWidth < p.getMinPatiosDimension()) {
                    return FootprintResult.rejected(RejectionReason.PATIO_TOO_SMALL,
                            String.format(Locale.US, "patio %.2f < min_patios_dimension %.2f",
                                    patioWidth, p.getMinPatiosDimension()));
                }
            }
        }

        double coreArea = areaModel.coreArea(p, area);
        double coreSide = areaModel.coreSide(p, area);
        if (coreSide > 0 && footprint.buffer(-coreSide / 2.0).isEmpty()) {
            return FootprintResult.rejected(RejectionReason.CORE_DOES_NOT_FIT,
                    String.format(Locale.US, "core %.2fx%.2f does not fit", coreSide, coreSide));
        }

        double circulation = 0.0;
        for (Geometry part : parts) {
            circulation += p.getAccessWidth() * geometry.longSide(part);
        }
        double usable = areaModel.usableArea(area, coreArea, circulation);

        return FootprintResult.accepted(footprint, coreArea, circulation, usable, hasSetback);
    }
}

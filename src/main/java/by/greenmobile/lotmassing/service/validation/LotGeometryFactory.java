package by.greenmobile.lotmassing.service.validation;

import by.greenmobile.lotmassing.dto.FaceSpec;
import by.greenmobile.lotmassing.dto.LotRequest;
import by.greenmobile.lotmassing.entity.BoundaryFace;
import by.greenmobile.lotmassing.entity.FaceRole;
import by.greenmobile.lotmassing.entity.LotGeometry;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Построение и проверка геометрии участка.
 *
 * Проверки:
 * - контур явно замкнут, не менее 4 точек (3 вершины + замыкающая);
 * - полигон валиден (без самопересечений), площадь > 0;
 * - каждая грань лежит на границе участка;
 * - грани вместе покрывают всю границу (без пропусков).
 */
@Component
@Slf4j
public class LotGeometryFactory {

    /** Допуск "точка на границе", м. */
    static final double BOUNDARY_TOLERANCE = 1e-6;

    /** Допустимая суммарная длина непокрытой гранями границы, м. */
    static final double COVERAGE_GAP_TOLERANCE = 1e-3;

    private final GeometryFactory gf = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    public LotGeometry fromRequest(LotRequest request) {
        String lotId = request.getLotId();
        if (lotId == null || lotId.isBlank()) {
            throw new InvalidLotException("<unnamed>", "lot id is required");
        }
        return build(lotId, request.getRing(), request.getFaces());
    }

    public LotGeometry build(String lotId, double[][] ring, List<FaceSpec> faceSpecs) {
        Polygon polygon = buildPolygon(lotId, ring);

        if (faceSpecs == null || faceSpecs.isEmpty()) {
            throw new InvalidLotException(lotId, "boundary faces are required");
        }

        Geometry boundary = gf.createLineString(polygon.getExteriorRing().getCoordinates());
        Geometry boundaryZone = boundary.buffer(BOUNDARY_TOLERANCE);

        List<BoundaryFace> faces = new ArrayList<>();
        for (int i = 0; i < faceSpecs.size(); i++) {
            FaceSpec spec = faceSpecs.get(i);
            FaceRole role;
            try {
                role = FaceRole.fromCode(spec.getRole());
            } catch (IllegalArgumentException e) {
                throw new InvalidLotException(lotId, "face #" + i + ": " + e.getMessage(), e);
            }
            Coordinate a = point(lotId, "face #" + i + " from", spec.getFrom());
            Coordinate b = point(lotId, "face #" + i + " to", spec.getTo());
            if (a.distance(b) <= BOUNDARY_TOLERANCE) {
                throw new InvalidLotException(lotId, "face #" + i + " has zero length");
            }
            LineString segment = gf.createLineString(new Coordinate[]{a, b});
            if (!boundaryZone.covers(segment)) {
                throw new InvalidLotException(lotId, "face #" + i + " (" + role + ") does not lie on the lot boundary");
            }
            faces.add(new BoundaryFace(role, segment));
        }

        List<Geometry> segments = new ArrayList<>();
        faces.forEach(f -> segments.add(f.getSegment()));
        Geometry covered = UnaryUnionOp.union(segments).buffer(BOUNDARY_TOLERANCE * 10);
        double gap = boundary.difference(covered).getLength();
        if (gap > COVERAGE_GAP_TOLERANCE) {
            throw new InvalidLotException(lotId, String.format(Locale.US,
                    "boundary faces leave %.3f m of the boundary unassigned", gap));
        }

        log.debug("LOT {}: area={} m2, faces={}", lotId, polygon.getArea(), faces.size());
        return new LotGeometry(lotId, polygon, List.copyOf(faces));
    }

    private Polygon buildPolygon(String lotId, double[][] ring) {
        if (ring == null || ring.length < 4) {
            throw new InvalidLotException(lotId, "lot ring needs at least 3 vertices plus the closing point");
        }
        Coordinate[] coords = new Coordinate[ring.length];
        for (int i = 0; i < ring.length; i++) {
            coords[i] = point(lotId, "ring point #" + i, ring[i]);
        }
        if (!coords[0].equals2D(coords[coords.length - 1])) {
            throw new InvalidLotException(lotId, "lot ring is not closed (first point must equal last)");
        }

        Polygon polygon = gf.createPolygon(coords);
        IsValidOp op = new IsValidOp(polygon);
        if (!op.isValid()) {
            TopologyValidationError err = op.getValidationError();
            throw new InvalidLotException(lotId, "invalid lot polygon: " + err.getMessage()
                    + " at " + err.getCoordinate());
        }
        if (polygon.getArea() <= 0) {
            throw new InvalidLotException(lotId, "lot polygon has zero area");
        }
        return polygon;
    }

    private Coordinate point(String lotId, String what, double[] xy) {
        if (xy == null || xy.length != 2 || !Double.isFinite(xy[0]) || !Double.isFinite(xy[1])) {
            throw new InvalidLotException(lotId, what + " must be a finite [x, y] pair");
        }
        return new Coordinate(xy[0], xy[1]);
    }
}

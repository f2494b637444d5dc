package by.greenmobile.lotmassing.service.geometry;

import by.greenmobile.lotmassing.entity.BoundaryFace;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.SetbackOffsets;
import by.greenmobile.lotmassing.entity.ShapeVariant;
import org.locationtech.jts.algorithm.MinimumDiameter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Геометрические операции над пятном этажа (JTS).
 *
 * Отступ от грани = исключение из участка полосы buffer(грань, d).
 * Так каждая грань получает свой отступ по своей роли, а на выпуклых углах
 * круглые торцы буфера дают честное расстояние до вершины.
 */
@Component
public class FaceOffsetGeometry {

    static final double EPS = 1e-9;

    /** Куски площадью меньше этого считаются численным мусором, м². */
    public static final double SLIVER_AREA = 1e-2;

    private static final int QUADRANT_SEGMENTS = 8;

    /** Участок, уменьшенный на отступы по ролям граней. Возвращает наибольший полигон (или пустой). */
    public Geometry offsetPolygon(LotGeometry lot, SetbackOffsets offsets) {
        Polygon lotPolygon = lot.getPolygon();

        List<Geometry> bands = new ArrayList<>();
        for (BoundaryFace face : lot.getFaces()) {
            double d = offsets.of(face.getRole());
            if (d <= EPS) continue;
            bands.add(face.getSegment().buffer(d, QUADRANT_SEGMENTS));
        }
        if (bands.isEmpty()) {
            return lotPolygon.copy();
        }

        Geometry removed = UnaryUnionOp.union(bands);
        return largestPolygon(lotPolygon.difference(removed));
    }

    /**
     * L-маска для варианта формы.
     *
     * База поворачивается на -orientation вокруг центра её охвата, в локальной системе строятся
     * два крыла у минимального угла (ширина ratio*W на всю высоту и высота ratio*H на всю ширину),
     * затем крылья возвращаются поворотом на +orientation.
     */
    public ShapeMask compositeMask(Geometry base, ShapeVariant variant) {
        GeometryFactory gf = base.getFactory();
        Coordinate c = base.getEnvelopeInternal().centre();
        double theta = Math.toRadians(variant.getOrientation());

        AffineTransformation toLocal = AffineTransformation.rotationInstance(-theta, c.x, c.y);
        AffineTransformation toWorld = AffineTransformation.rotationInstance(theta, c.x, c.y);

        Envelope env = toLocal.transform(base).getEnvelopeInternal();
        double ratio = variant.getShapeRatio();
        double legWidth = env.getWidth() * ratio;
        double legHeight = env.getHeight() * ratio;

        Geometry vertical = gf.toGeometry(new Envelope(
                env.getMinX(), env.getMinX() + legWidth, env.getMinY(), env.getMaxY()));
        Geometry horizontal = gf.toGeometry(new Envelope(
                env.getMinX(), env.getMaxX(), env.getMinY(), env.getMinY() + legHeight));

        List<Geometry> wings = List.of(toWorld.transform(vertical), toWorld.transform(horizontal));
        return new ShapeMask(UnaryUnionOp.union(wings), wings);
    }

    /** Минимальная ширина полосы, в которую помещается геометрия. */
    public double minimumWidth(Geometry g) {
        if (g == null || g.isEmpty()) return 0.0;
        return new MinimumDiameter(g).getLength();
    }

    /** Длинная сторона минимального охватывающего прямоугольника. */
    public double longSide(Geometry g) {
        if (g == null || g.isEmpty()) return 0.0;
        Coordinate[] r = new MinimumDiameter(g).getMinimumRectangle().getCoordinates();
        if (r.length < 4) {
            // вырожденный случай: отрезок или точка
            return r.length == 2 ? r[0].distance(r[1]) : 0.0;
        }
        return Math.max(r[0].distance(r[1]), r[1].distance(r[2]));
    }

    /** Наибольший полигон из результата overlay; пустой полигон, если полигонов нет. */
    public static Geometry largestPolygon(Geometry g) {
        Geometry best = null;
        for (int i = 0; i < g.getNumGeometries(); i++) {
            Geometry part = g.getGeometryN(i);
            if (!(part instanceof Polygon) || part.isEmpty()) continue;
            if (best == null || part.getArea() > best.getArea()) best = part;
        }
        return best != null ? best : g.getFactory().createPolygon();
    }
}

package by.greenmobile.lotmassing.service.export;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotResult;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * SVG-план участка:
 * - граница участка;
 * - базовый стек: пятно первого этажа (заливка) и верхнего этажа (пунктир);
 * - лучший вариант формы: первый и верхний этажи (оранжевый).
 * <p>
 * ВАЖНО: координаты в метрах, ось Y переворачивается группой (в SVG Y вниз).
 */
@Service
@Slf4j
public class MassingSvgService {

    private static final double PADDING = 5.0;

    public String generateSvg(LotResult result) {
        if (result == null || result.getLotPolygon() == null) {
            log.warn("generateSvg(): no lot geometry");
            return "";
        }

        Polygon lot = result.getLotPolygon();
        Envelope env = lot.getEnvelopeInternal();
        double minX = env.getMinX() - PADDING;
        double minY = env.getMinY() - PADDING;
        double w = env.getWidth() + 2 * PADDING;
        double h = env.getHeight() + 2 * PADDING;

        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" ")
                .append("width=\"").append(fmt(w * 10)).append("\" ")
                .append("height=\"").append(fmt(h * 10)).append("\" ")
                .append("viewBox=\"")
                .append(fmt(minX)).append(" ")
                .append(fmt(minY)).append(" ")
                .append(fmt(w)).append(" ")
                .append(fmt(h)).append("\">\n");

        // фон
        svg.append("  <rect x=\"").append(fmt(minX)).append("\" y=\"").append(fmt(minY))
                .append("\" width=\"").append(fmt(w))
                .append("\" height=\"").append(fmt(h))
                .append("\" fill=\"#f4f7fb\" />\n");

        svg.append("  <g transform=\"translate(0,").append(fmt(2 * minY + h)).append(") scale(1,-1)\">\n");

        // участок
        svg.append("    <path d=\"").append(pathFor(lot))
                .append("\" fill=\"#ffffff\" stroke=\"#000000\" stroke-width=\"0.3\" />\n");

        int drawn = 0;
        drawn += drawStack(svg, result.getBaseline(), "#6baed6", "#08519c");
        drawn += drawStack(svg, result.getBest(), "#fdae6b", "#d94801");

        svg.append("  </g>\n");
        svg.append("</svg>");

        log.info("SVG {}: контуров={}, best={}", result.getLotId(), drawn,
                result.getBestVariant() != null ? result.getBestVariant().getId() : "-");
        return svg.toString();
    }

    private int drawStack(StringBuilder svg, FloorStack stack, String fill, String stroke) {
        if (stack == null || stack.isEmpty()) return 0;

        FloorRecord ground = stack.getFloors().get(0);
        FloorRecord top = stack.getFloors().get(stack.getFloorCount() - 1);

        appendGeometry(svg, ground.getFootprint(),
                "fill=\"" + fill + "\" fill-opacity=\"0.55\" stroke=\"" + stroke + "\" stroke-width=\"0.25\"",
                ground.getLabel() + " | " + fmt(ground.getFootprintArea()) + " m2");
        if (top != ground) {
            appendGeometry(svg, top.getFootprint(),
                    "fill=\"none\" stroke=\"" + stroke + "\" stroke-width=\"0.25\" stroke-dasharray=\"1,0.6\"",
                    top.getLabel() + " | " + fmt(top.getFootprintArea()) + " m2");
            return 2;
        }
        return 1;
    }

    private void appendGeometry(StringBuilder svg, Geometry g, String style, String title) {
        for (int i = 0; i < g.getNumGeometries(); i++) {
            if (!(g.getGeometryN(i) instanceof Polygon poly)) continue;
            svg.append("    <path d=\"").append(pathFor(poly)).append("\" ").append(style).append(">\n");
            svg.append("      <title>").append(title).append("</title>\n");
            svg.append("    </path>\n");
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    static String pathFor(Polygon poly) {
        StringBuilder sb = new StringBuilder();
        appendRing(sb, poly.getExteriorRing());
        for (int i = 0; i < poly.getNumInteriorRing(); i++) {
            appendRing(sb, poly.getInteriorRingN(i));
        }
        return sb.toString().trim();
    }

    private static void appendRing(StringBuilder sb, LineString ring) {
        Coordinate[] c = ring.getCoordinates();
        if (c.length == 0) return;
        sb.append("M ").append(fmt(c[0].x)).append(" ").append(fmt(c[0].y)).append(" ");
        for (int i = 1; i < c.length; i++) {
            sb.append("L ").append(fmt(c[i].x)).append(" ").append(fmt(c[i].y)).append(" ");
        }
        sb.append("Z ");
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.3f", v);
    }
}

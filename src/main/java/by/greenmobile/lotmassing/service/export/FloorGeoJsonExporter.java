package by.greenmobile.lotmassing.service.export;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.LotResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Этажи в GeoJSON FeatureCollection (один Feature на этаж).
 *
 * Свойства: lot_id, floor_index, floor_name, base_elevation, floor_height,
 * footprint_area, has_setback и shape_variant (только для стека оптимизатора).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FloorGeoJsonExporter {

    public enum Variant { BASELINE, BEST }

    private final ObjectMapper objectMapper;

    public String export(List<LotResult> results, Variant variant) {
        ObjectNode fc = objectMapper.createObjectNode();
        fc.put("type", "FeatureCollection");
        ArrayNode features = fc.putArray("features");

        int count = 0;
        for (LotResult r : results) {
            FloorStack stack = variant == Variant.BEST ? r.getBest() : r.getBaseline();
            if (stack == null) continue;
            for (FloorRecord f : stack.getFloors()) {
                features.add(feature(r.getLotId(), f));
                count++;
            }
        }

        log.info("GEOJSON {}: {} floors from {} lots", variant, count, results.size());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(fc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("GeoJSON serialization failed", e);
        }
    }

    private ObjectNode feature(String lotId, FloorRecord f) {
        ObjectNode feature = objectMapper.createObjectNode();
        feature.put("type", "Feature");
        feature.set("geometry", geometry(f.getFootprint()));

        ObjectNode props = feature.putObject("properties");
        props.put("lot_id", lotId);
        props.put("floor_index", f.getFloorIndex());
        props.put("floor_name", f.getLabel());
        props.put("base_elevation", f.getBaseElevation());
        props.put("floor_height", f.getFloorHeight());
        props.put("footprint_area", f.getFootprintArea());
        props.put("has_setback", f.isHasSetback());
        if (f.getVariant() != null) {
            props.put("shape_variant", f.getVariant().getId());
            props.put("shape_ratio", f.getVariant().getShapeRatio());
            props.put("orientation", f.getVariant().getOrientation());
        }
        return feature;
    }

    private ObjectNode geometry(Geometry g) {
        ObjectNode geom = objectMapper.createObjectNode();
        if (g instanceof Polygon polygon) {
            geom.put("type", "Polygon");
            geom.set("coordinates", polygonRings(polygon));
            return geom;
        }
        geom.put("type", "MultiPolygon");
        ArrayNode polys = geom.putArray("coordinates");
        for (int i = 0; i < g.getNumGeometries(); i++) {
            if (g.getGeometryN(i) instanceof Polygon part) {
                polys.add(polygonRings(part));
            }
        }
        return geom;
    }

    private ArrayNode polygonRings(Polygon polygon) {
        ArrayNode rings = objectMapper.createArrayNode();
        rings.add(ring(polygon.getExteriorRing()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(ring(polygon.getInteriorRingN(i)));
        }
        return rings;
    }

    private ArrayNode ring(LineString ring) {
        ArrayNode arr = objectMapper.createArrayNode();
        for (Coordinate c : ring.getCoordinates()) {
            ArrayNode xy = arr.addArray();
            xy.add(c.x);
            xy.add(c.y);
        }
        return arr;
    }
}

package by.greenmobile.lotmassing.service.geometry;

import lombok.Value;
import org.locationtech.jts.geom.Geometry;

import java.util.List;

/** Маска составной формы: объединение крыльев + сами крылья по отдельности. */
@Value
public class ShapeMask {
    Geometry mask;
    List<Geometry> wings;
}

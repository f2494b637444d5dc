package by.greenmobile.lotmassing.service.engine;

import by.greenmobile.lotmassing.entity.FloorRecord;
import by.greenmobile.lotmassing.entity.FloorStack;
import by.greenmobile.lotmassing.entity.ParameterSet;
import org.springframework.stereotype.Component;

/**
 * Разбивка площади этажа: ядро (лестницы/лифты), коридор доступа, полезная площадь, квартиры.
 *
 * ядро     = core_area_fraction * площадь пятна
 * коридор  = access_width * длинная сторона каждого крыла
 * полезная = площадь - ядро - коридор (не меньше 0)
 * квартир  = floor(полезная / target_unit_area), если полезная >= min_unit_area
 */
@Component
public class FloorAreaModel {

    public double coreArea(ParameterSet p, double footprintArea) {
        return p.getCoreAreaFraction() * footprintArea;
    }

    /** Сторона квадратного ядра, м. */
    public double coreSide(ParameterSet p, double footprintArea) {
        return Math.sqrt(coreArea(p, footprintArea));
    }

    public double usableArea(double footprintArea, double coreArea, double circulationArea) {
        return Math.max(0.0, footprintArea - coreArea - circulationArea);
    }

    public int unitsOn(FloorRecord floor, ParameterSet p) {
        double usable = floor.getUsableArea();
        if (usable < p.getMinUnitArea() || p.getTargetUnitArea() <= 0) return 0;
        return (int) Math.floor(usable / p.getTargetUnitArea() + 1e-9);
    }

    public int unitsIn(FloorStack stack, ParameterSet p) {
        return stack.getFloors().stream().mapToInt(f -> unitsOn(f, p)).sum();
    }
}

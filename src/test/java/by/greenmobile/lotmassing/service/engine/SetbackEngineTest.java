package by.greenmobile.lotmassing.service.engine;

import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.SetbackOffsets;
import by.greenmobile.lotmassing.support.Fixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SetbackEngineTest {

    private final SetbackEngine engine = new SetbackEngine();

    @Test
    void backOffsetStaysAtMinimumBelowStartFloor() {
        ParameterSet p = Fixtures.example1().toBuilder().backSetbackPercent(0.9).build();

        for (int floor = 1; floor < p.getMinSetbackStartFloor(); floor++) {
            double below = 4.0 + 3.0 * (floor - 2);
            SetbackOffsets o = engine.offsets(p, floor, Math.max(0, below));
            assertThat(o.getBack()).isEqualTo(p.getMinBackSetback());
        }
    }

    @Test
    void backOffsetFollowsPercentageFromStartFloor() {
        ParameterSet p = Fixtures.example1();

        assertThat(engine.offsets(p, 4, 10.0).getBack()).isEqualTo(3.0);
        assertThat(engine.offsets(p, 6, 16.0).getBack()).isCloseTo(3.2, org.assertj.core.data.Offset.offset(1e-12));
        assertThat(engine.offsets(p, 14, 40.0).getBack()).isCloseTo(8.0, org.assertj.core.data.Offset.offset(1e-12));
    }

    @Test
    void backOffsetIsMonotoneForFixedFloorHeights() {
        ParameterSet p = Fixtures.example1();

        double below = 0.0;
        double previous = 0.0;
        for (int floor = 1; floor <= 30; floor++) {
            double back = engine.offsets(p, floor, below).getBack();
            assertThat(back).isGreaterThanOrEqualTo(previous);
            previous = back;
            below += floor == 1 ? p.getGfFloorHeight() : p.getUfFloorHeight();
        }
    }

    @Test
    void frontAndSideNeverEscalate() {
        ParameterSet p = Fixtures.example1();

        SetbackOffsets high = engine.offsets(p, 40, 200.0);
        assertThat(high.getFront()).isEqualTo(p.getMinFrontSetback());
        assertThat(high.getSide()).isEqualTo(p.getMinSideSetback());
    }
}

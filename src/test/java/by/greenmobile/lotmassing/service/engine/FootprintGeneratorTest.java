package by.greenmobile.lotmassing.service.engine;

import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.entity.SetbackOffsets;
import by.greenmobile.lotmassing.entity.ShapeVariant;
import by.greenmobile.lotmassing.support.Fixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FootprintGeneratorTest {

    private final Fixtures.Engine engine = Fixtures.engine();
    private final FootprintGenerator generator = engine.footprintGenerator;
    private final LotGeometry lot = Fixtures.rectangleLot("R-25x50", 25, 50);

    @Test
    void plainOffsetOfRectangle() {
        ParameterSet p = Fixtures.example1();

        FootprintResult r = generator.generate(lot, p, SetbackOffsets.minimums(p), ShapeVariant.ORTHOGONAL);

        assertThat(r.isAccepted()).isTrue();
        assertThat(r.getArea()).isCloseTo(22.0 * 42.0, within(1e-6));
        assertThat(r.isHasSetback()).isTrue();
        assertThat(r.getFootprint().getEnvelopeInternal().getMinX()).isCloseTo(1.5, within(1e-9));
        assertThat(r.getFootprint().getEnvelopeInternal().getMaxY()).isCloseTo(45.0, within(1e-9));
    }

    @Test
    void usableAreaExcludesCoreAndCorridor() {
        ParameterSet p = Fixtures.example1();

        FootprintResult r = generator.generate(lot, p, SetbackOffsets.minimums(p), ShapeVariant.ORTHOGONAL);

        assertThat(r.getCoreArea()).isCloseTo(0.15 * 924.0, within(1e-6));
        assertThat(r.getCirculationArea()).isCloseTo(1.2 * 42.0, within(1e-6));
        assertThat(r.getUsableArea()).isCloseTo(924.0 - 138.6 - 50.4, within(1e-6));
    }

    @Test
    void zeroOffsetsDoNotMarkSetback() {
        ParameterSet p = Fixtures.example1();

        FootprintResult r = generator.generate(lot, p, new SetbackOffsets(0, 0, 0), ShapeVariant.ORTHOGONAL);

        assertThat(r.isAccepted()).isTrue();
        assertThat(r.getArea()).isCloseTo(1250.0, within(1e-6));
        assertThat(r.isHasSetback()).isFalse();
    }

    @Test
    void lShapeKeepsBothWings() {
        ParameterSet p = Fixtures.example1();

        FootprintResult r = generator.generate(lot, p, SetbackOffsets.minimums(p), ShapeVariant.lShape(0.5, 0));

        assertThat(r.isAccepted()).isTrue();
        // 22x42 минус угол 11x21
        assertThat(r.getArea()).isCloseTo(924.0 - 11.0 * 21.0, within(1e-6));
        assertThat(r.getFootprint().getEnvelopeInternal().getWidth()).isCloseTo(22.0, within(1e-6));
        assertThat(r.getFootprint().getEnvelopeInternal().getHeight()).isCloseTo(42.0, within(1e-6));
    }

    @Test
    void orientationsGiveSameAreaOnRectangle() {
        ParameterSet p = Fixtures.example1();

        for (double orientation : new double[]{0, 90, 180, 270}) {
            FootprintResult r = generator.generate(lot, p, SetbackOffsets.minimums(p),
                    ShapeVariant.lShape(0.3, orientation));
            assertThat(r.isAccepted()).as("orientation %s", orientation).isTrue();
            assertThat(r.getArea()).isCloseTo(924.0 * (1 - 0.7 * 0.7), within(1e-6));
        }
    }

    @Test
    void rejectsWhenSetbacksConsumeDepth() {
        ParameterSet p = Fixtures.example1().toBuilder().minFrontSetback(30).minBackSetback(20).build();

        FootprintResult r = generator.generate(lot, p, SetbackOffsets.minimums(p), ShapeVariant.ORTHOGONAL);

        assertThat(r.isAccepted()).isFalse();
        assertThat(r.getRejection()).isEqualTo(RejectionReason.EMPTY);
    }

    @Test
    void rejectsBelowMinimumArea() {
        ParameterSet p = Fixtures.example1().toBuilder().minFloorArea(1000).build();

        FootprintResult r = generator.generate(lot, p, SetbackOffsets.minimums(p), ShapeVariant.ORTHOGONAL);

        assertThat(r.getRejection()).isEqualTo(RejectionReason.BELOW_MIN_AREA);
    }

    @Test
    void rejectsNarrowFootprint() {
        LotGeometry narrow = Fixtures.rectangleLot("N-4x50", 4, 50);
        ParameterSet p = Fixtures.example1().toBuilder().minFloorArea(10).build();

        FootprintResult r = generator.generate(narrow, p, SetbackOffsets.minimums(p), ShapeVariant.ORTHOGONAL);

        assertThat(r.getRejection()).isEqualTo(RejectionReason.TOO_NARROW);
    }

    @Test
    void rejectsTightPatio() {
        ParameterSet p = Fixtures.example1();

        // угловой двор 2.2 x 4.2 м < min_patios_dimension 4
        FootprintResult r = generator.generate(lot, p, SetbackOffsets.minimums(p), ShapeVariant.lShape(0.9, 0));

        assertThat(r.getRejection()).isEqualTo(RejectionReason.PATIO_TOO_SMALL);
    }

    @Test
    void rejectsWhenCoreDoesNotFit() {
        LotGeometry slab = Fixtures.rectangleLot("S-10x200", 10, 200);
        ParameterSet p = Fixtures.example1();

        // ядро sqrt(0.15 * 2000) = 17.3 м шире пятна 10 м
        FootprintResult r = generator.generate(slab, p, new SetbackOffsets(0, 0, 0), ShapeVariant.ORTHOGONAL);

        assertThat(r.getRejection()).isEqualTo(RejectionReason.CORE_DOES_NOT_FIT);
    }
}

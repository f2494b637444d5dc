package by.greenmobile.lotmassing.service.validation;

import by.greenmobile.lotmassing.dto.FaceSpec;
import by.greenmobile.lotmassing.entity.FaceRole;
import by.greenmobile.lotmassing.entity.LotGeometry;
import by.greenmobile.lotmassing.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LotGeometryFactoryTest {

    private final LotGeometryFactory factory = new LotGeometryFactory();

    @Test
    void buildsRectangle() {
        LotGeometry lot = Fixtures.rectangleLot("A-1", 25, 50);

        assertThat(lot.area()).isCloseTo(1250.0, within(1e-9));
        assertThat(lot.getFaces()).hasSize(4);
        assertThat(lot.facesOf(FaceRole.SIDE)).hasSize(2);
        assertThat(lot.facesOf(FaceRole.FRONT)).hasSize(1);
    }

    @Test
    void rejectsOpenRing() {
        double[][] ring = {{0, 0}, {25, 0}, {25, 50}, {0, 50}};

        assertThatThrownBy(() -> factory.build("OPEN", ring, Fixtures.rectangleFaces(25, 50)))
                .isInstanceOf(InvalidLotException.class)
                .hasMessageContaining("OPEN")
                .hasMessageContaining("not closed");
    }

    @Test
    void rejectsSelfIntersectingRing() {
        double[][] bowtie = {{0, 0}, {10, 10}, {10, 0}, {0, 10}, {0, 0}};
        List<FaceSpec> faces = List.of(
                new FaceSpec("side", new double[]{0, 0}, new double[]{10, 10}),
                new FaceSpec("side", new double[]{10, 10}, new double[]{10, 0}),
                new FaceSpec("side", new double[]{10, 0}, new double[]{0, 10}),
                new FaceSpec("side", new double[]{0, 10}, new double[]{0, 0}));

        assertThatThrownBy(() -> factory.build("BOWTIE", bowtie, faces))
                .isInstanceOf(InvalidLotException.class)
                .hasMessageContaining("invalid lot polygon");
    }

    @Test
    void rejectsFaceOffBoundary() {
        double[][] ring = {{0, 0}, {25, 0}, {25, 50}, {0, 50}, {0, 0}};
        List<FaceSpec> faces = new ArrayList<>(Fixtures.rectangleFaces(25, 50));
        faces.add(new FaceSpec("front", new double[]{5, 10}, new double[]{20, 10}));

        assertThatThrownBy(() -> factory.build("OFF", ring, faces))
                .isInstanceOf(InvalidLotException.class)
                .hasMessageContaining("does not lie on the lot boundary");
    }

    @Test
    void rejectsBoundaryGaps() {
        double[][] ring = {{0, 0}, {25, 0}, {25, 50}, {0, 50}, {0, 0}};
        List<FaceSpec> faces = Fixtures.rectangleFaces(25, 50).subList(0, 3);

        assertThatThrownBy(() -> factory.build("GAP", ring, faces))
                .isInstanceOf(InvalidLotException.class)
                .hasMessageContaining("unassigned");
    }

    @Test
    void rejectsUnknownRole() {
        double[][] ring = {{0, 0}, {25, 0}, {25, 50}, {0, 50}, {0, 0}};
        List<FaceSpec> faces = new ArrayList<>(Fixtures.rectangleFaces(25, 50));
        faces.set(0, new FaceSpec("rear", new double[]{0, 0}, new double[]{25, 0}));

        assertThatThrownBy(() -> factory.build("ROLE", ring, faces))
                .isInstanceOf(InvalidLotException.class)
                .hasMessageContaining("unknown face role");
    }

    @Test
    void acceptsSplitFaces() {
        double[][] ring = {{0, 0}, {25, 0}, {25, 50}, {0, 50}, {0, 0}};
        List<FaceSpec> faces = new ArrayList<>(Fixtures.rectangleFaces(25, 50));
        faces.set(2, new FaceSpec("front", new double[]{25, 50}, new double[]{10, 50}));
        faces.add(new FaceSpec("side", new double[]{10, 50}, new double[]{0, 50}));

        LotGeometry lot = factory.build("SPLIT", ring, faces);

        assertThat(lot.getFaces()).hasSize(5);
    }
}

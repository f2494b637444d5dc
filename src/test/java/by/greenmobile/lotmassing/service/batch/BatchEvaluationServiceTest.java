package by.greenmobile.lotmassing.service.batch;

import by.greenmobile.lotmassing.dto.BatchRequest;
import by.greenmobile.lotmassing.dto.LotRequest;
import by.greenmobile.lotmassing.entity.BatchReport;
import by.greenmobile.lotmassing.entity.LotResult;
import by.greenmobile.lotmassing.entity.LotStatus;
import by.greenmobile.lotmassing.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BatchEvaluationServiceTest {

    private final BatchEvaluationService service = new BatchEvaluationService(Fixtures.engine().facade);

    @Test
    void failuresAreIsolatedPerLot() throws InterruptedException {
        LotRequest good = Fixtures.rectangleRequest("GOOD", 25, 50);
        LotRequest open = Fixtures.rectangleRequest("OPEN", 25, 50);
        open.setRing(new double[][]{{0, 0}, {25, 0}, {25, 50}, {0, 50}});
        LotRequest tight = Fixtures.rectangleRequest("TIGHT", 25, 50);
        tight.setParameters(Map.of("min_front_setback", 30.0, "min_back_setback", 20.0));

        BatchReport report = service.run(BatchRequest.builder()
                .projectParameters(Map.of("max_height", 45.0))
                .lots(List.of(good, open, tight))
                .build());

        assertThat(report.getResults()).extracting(LotResult::getLotId).containsExactly("GOOD", "OPEN", "TIGHT");
        assertThat(report.getResults()).extracting(LotResult::getStatus)
                .containsExactly(LotStatus.OK, LotStatus.FAILED, LotStatus.INFEASIBLE);
        assertThat(report.getOkCount()).isEqualTo(1);
        assertThat(report.getFailedCount()).isEqualTo(1);
        assertThat(report.getInfeasibleCount()).isEqualTo(1);
        assertThat(report.isCancelled()).isFalse();

        assertThat(report.getResults().get(0).getBaseline().getTotalHeight()).isLessThanOrEqualTo(45.0);
        assertThat(report.getResults().get(1).getMessage()).contains("not closed");
        assertThat(report.getResults().get(2).getBaseline().isEmpty()).isTrue();
    }

    @Test
    void cancelKeepsCommittedResultsIntact() throws InterruptedException {
        service.setThreads(1);
        List<LotRequest> lots = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            lots.add(Fixtures.rectangleRequest("L-" + i, 25, 50));
        }

        BatchHandle handle = service.submit(BatchRequest.builder().lots(lots).build());
        handle.cancel();
        BatchReport report = handle.await();

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.getResults()).hasSize(20);
        assertThat(report.getOkCount() + report.getCancelledCount()).isEqualTo(20);
        assertThat(report.getCancelledCount()).isPositive();
        assertThat(report.getResults())
                .filteredOn(r -> r.getStatus() == LotStatus.OK)
                .allSatisfy(r -> assertThat(r.getBaseline()).isNotNull());
    }

    @Test
    void repeatedLotIdsKeepOneResultPerInputLot() throws InterruptedException {
        LotRequest feasible = Fixtures.rectangleRequest("DUP", 25, 50);
        LotRequest tight = Fixtures.rectangleRequest("DUP", 25, 50);
        tight.setParameters(Map.of("min_front_setback", 30.0, "min_back_setback", 20.0));

        BatchReport report = service.run(BatchRequest.builder().lots(List.of(feasible, tight)).build());

        assertThat(report.getResults()).extracting(LotResult::getLotId).containsExactly("DUP", "DUP");
        assertThat(report.getResults()).extracting(LotResult::getStatus)
                .containsExactly(LotStatus.OK, LotStatus.INFEASIBLE);
        assertThat(report.getOkCount()).isEqualTo(1);
        assertThat(report.getInfeasibleCount()).isEqualTo(1);
    }

    @Test
    void emptyBatchCompletes() throws InterruptedException {
        BatchReport report = service.run(BatchRequest.builder().lots(List.of()).build());

        assertThat(report.getResults()).isEmpty();
        assertThat(report.getOkCount()).isZero();
    }
}

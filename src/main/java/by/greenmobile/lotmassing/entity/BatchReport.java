package by.greenmobile.lotmassing.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchReport {
    String batchId;
    List<LotResult> results;
    int okCount;
    int infeasibleCount;
    int failedCount;
    int cancelledCount;
    boolean cancelled;
}

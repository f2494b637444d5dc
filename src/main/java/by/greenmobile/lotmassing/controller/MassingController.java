package by.greenmobile.lotmassing.controller;

import by.greenmobile.lotmassing.config.ParameterSetResolver;
import by.greenmobile.lotmassing.dto.BatchRequest;
import by.greenmobile.lotmassing.dto.LotRequest;
import by.greenmobile.lotmassing.entity.BatchReport;
import by.greenmobile.lotmassing.entity.LotResult;
import by.greenmobile.lotmassing.entity.ParameterSet;
import by.greenmobile.lotmassing.service.MassingFacade;
import by.greenmobile.lotmassing.service.batch.BatchEvaluationService;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST-вход: расчёт одного участка и пакета.
 * Последний результат кладётся в сессию для выгрузок (ExportController).
 */
@RestController
@RequestMapping("/api/massing")
@RequiredArgsConstructor
@Slf4j
public class MassingController {

    private final MassingFacade facade;
    private final BatchEvaluationService batchService;
    private final ParameterSetResolver parameterResolver;

    @GetMapping("/defaults")
    public ParameterSet defaults() {
        return parameterResolver.defaults();
    }

    @PostMapping("/lot")
    public ResponseEntity<LotResult> evaluateLot(@RequestBody LotRequest request, HttpSession session) {
        LotResult result = facade.evaluate(request, Map.of(), () -> false);
        session.setAttribute(SessionResults.ATTRIBUTE, new SessionResults(List.of(result)));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchReport> evaluateBatch(@RequestBody BatchRequest request, HttpSession session)
            throws InterruptedException {
        BatchReport report = batchService.run(request);
        session.setAttribute(SessionResults.ATTRIBUTE, new SessionResults(report.getResults()));
        return ResponseEntity.ok(report);
    }
}

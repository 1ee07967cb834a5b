package com.example.tablecompare.web;

import com.example.tablecompare.application.ReconciliationSession;
import com.example.tablecompare.application.ReconciliationSessionService;
import com.example.tablecompare.application.ReconciliationStore;
import com.example.tablecompare.application.TableComparisonUseCase;
import com.example.tablecompare.domain.ComparisonRequest;
import com.example.tablecompare.domain.ComparisonResult;
import com.example.tablecompare.domain.ComparisonTiming;
import com.example.tablecompare.domain.CorrectedFile;
import com.example.tablecompare.domain.Difference;
import com.example.tablecompare.domain.DifferenceFilter;
import com.example.tablecompare.domain.DifferenceKind;
import com.example.tablecompare.domain.DifferenceStats;
import com.example.tablecompare.domain.DifferenceStatus;
import com.example.tablecompare.domain.TableSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/comparisons")
public class TableCompareController {
    private static final Logger log = LogManager.getLogger(TableCompareController.class);
    private static final MediaType TEXT_CSV =
            new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final TableComparisonUseCase comparisonUseCase;
    private final MultipartTableInputAdapter tableInputAdapter;
    private final ReconciliationSessionService sessionService;

    public TableCompareController(
            TableComparisonUseCase comparisonUseCase,
            MultipartTableInputAdapter tableInputAdapter,
            ReconciliationSessionService sessionService) {
        this.comparisonUseCase = comparisonUseCase;
        this.tableInputAdapter = tableInputAdapter;
        this.sessionService = sessionService;
    }

    @GetMapping
    public List<SessionView> listComparisons() {
        return sessionService.listSessions().stream().map(SessionView::of).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionView compare(
            @RequestParam("original") MultipartFile original,
            @RequestParam("updated") MultipartFile updated)
            throws IOException {
        ComparisonRequest request =
                new ComparisonRequest(
                        tableInputAdapter.adapt(original), tableInputAdapter.adapt(updated));
        ComparisonResult result = comparisonUseCase.compare(request);
        ReconciliationSession session =
                sessionService.open(
                        tableInputAdapter.describeComparison(original, updated), result);
        return SessionView.of(session);
    }

    @GetMapping("/{id}")
    public SessionView viewComparison(@PathVariable("id") long id) {
        return SessionView.of(sessionService.loadSession(id));
    }

    @PostMapping("/{id}/rerun")
    public SessionView rerun(
            @PathVariable("id") long id, @RequestParam("updated") MultipartFile updated)
            throws IOException {
        ReconciliationSession session = sessionService.loadSession(id);
        comparisonUseCase.recompare(session, tableInputAdapter.adapt(updated));
        return SessionView.of(session);
    }

    @GetMapping("/{id}/differences")
    public DifferencesView differences(
            @PathVariable("id") long id,
            @RequestParam(name = "kind", required = false) DifferenceKind kind,
            @RequestParam(name = "status", required = false) DifferenceStatus status,
            @RequestParam(name = "search", required = false) String search) {
        ReconciliationStore store = sessionService.loadSession(id).getStore();
        DifferenceFilter filter = new DifferenceFilter(kind, status, search);
        List<Difference> matched = store.filter(filter);
        return new DifferencesView(id, filter, store.stats(), matched.size(), matched);
    }

    @PutMapping("/{id}/differences/{row}/{column}")
    public StatusUpdateView updateStatus(
            @PathVariable("id") long id,
            @PathVariable("row") int rowPosition,
            @PathVariable("column") int columnIndex,
            @RequestBody UpdateStatusRequest body) {
        ReconciliationStore store = sessionService.loadSession(id).getStore();
        boolean updated = store.setStatus(rowPosition, columnIndex, body.getStatus());
        return new StatusUpdateView(
                rowPosition, columnIndex, body.getStatus(), updated, store.stats());
    }

    @GetMapping("/{id}/corrected")
    public ResponseEntity<byte[]> downloadCorrected(@PathVariable("id") long id) {
        CorrectedFile corrected = comparisonUseCase.correct(sessionService.loadSession(id));
        return ResponseEntity.ok()
                .header(
                        HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment()
                                .filename(corrected.fileName())
                                .build()
                                .toString())
                .contentType(TEXT_CSV)
                .body(corrected.content().getBytes(StandardCharsets.UTF_8));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void discard(@PathVariable("id") long id) {
        sessionService.discard(id);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorView handleInvalidUpload(IllegalArgumentException ex) {
        log.warn("Rejected upload: {}", ex.getMessage());
        return new ErrorView(ex.getMessage());
    }

    @ExceptionHandler(IOException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorView handleUnreadableUpload(IOException ex) {
        log.warn("Failed to read upload", ex);
        return new ErrorView("Failed to read uploaded file");
    }

    public record SessionView(
            long id,
            String name,
            LocalDateTime created,
            TableSummary original,
            TableSummary updated,
            DifferenceStats stats,
            boolean canApply,
            ComparisonTiming timing) {

        static SessionView of(ReconciliationSession session) {
            ReconciliationStore store = session.getStore();
            return new SessionView(
                    session.getId(),
                    session.getName(),
                    session.getCreated(),
                    session.getOriginalSummary(),
                    session.getUpdatedSummary(),
                    store.stats(),
                    store.hasAccepted(),
                    session.getTiming());
        }
    }

    public record DifferencesView(
            long id,
            DifferenceFilter filter,
            DifferenceStats stats,
            int matched,
            List<Difference> differences) {}

    public record StatusUpdateView(
            int rowPosition,
            int columnIndex,
            DifferenceStatus status,
            boolean updated,
            DifferenceStats stats) {}

    public record ErrorView(String message) {}
}

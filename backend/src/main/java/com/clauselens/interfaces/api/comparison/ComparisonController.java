package com.clauselens.interfaces.api.comparison;

import com.clauselens.application.comparison.ComparisonAppService;
import com.clauselens.application.comparison.ComparisonOverview;
import com.clauselens.application.comparison.CreateComparisonCommand;
import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.model.ComparisonStatusSnapshot;
import com.clauselens.infrastructure.stream.ComparisonStatusBroadcaster;
import com.clauselens.interfaces.api.dto.ComparisonDetailResponse;
import com.clauselens.interfaces.api.dto.ComparisonResponse;
import com.clauselens.interfaces.api.dto.CreateComparisonRequest;
import com.clauselens.interfaces.api.dto.RenameComparisonRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/v1/comparisons")
@RequiredArgsConstructor
public class ComparisonController {

    private final ComparisonAppService comparisonAppService;
    private final ComparisonStatusBroadcaster statusBroadcaster;

    @PostMapping
    public ResponseEntity<ComparisonResponse> create(@Valid @RequestBody CreateComparisonRequest request) {
        ComparisonOverview created = comparisonAppService.create(new CreateComparisonCommand(
                request.orgId(), request.name(), request.comparisonType(),
                request.sourceText(), request.targetText(),
                request.sourceName(), request.targetName(),
                request.sourceFilename(), request.targetFilename(),
                request.sourceContractId(), request.targetContractId()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ComparisonResponse.from(created));
    }

    @GetMapping
    public ResponseEntity<List<ComparisonResponse>> list(@RequestParam(required = false) String orgId) {
        return ResponseEntity.ok(comparisonAppService.list(orgId).stream()
                .map(ComparisonResponse::from)
                .toList());
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String orgId,
                             @RequestParam(required = false) String ids) {
        List<String> comparisonIds = ids == null ? List.of() : Arrays.stream(ids.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .toList();
        return statusBroadcaster.openSseStream(comparisonAppService.resolveOrgId(orgId), comparisonIds);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ComparisonDetailResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(ComparisonDetailResponse.from(comparisonAppService.getDetail(id)));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<ComparisonStatusSnapshot> status(@PathVariable String id) {
        return ResponseEntity.ok(comparisonAppService.getStatus(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ComparisonResponse> rename(@PathVariable String id,
                                                     @Valid @RequestBody RenameComparisonRequest request) {
        Comparison renamed = comparisonAppService.rename(id, request.name());
        return ResponseEntity.ok(ComparisonResponse.from(renamed, null, null));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        comparisonAppService.delete(id);
        return ResponseEntity.noContent().build();
    }
}

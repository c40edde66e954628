package com.clauselens.interfaces.api.contract;

import com.clauselens.application.contract.ContractAppService;
import com.clauselens.application.contract.CreateContractCommand;
import com.clauselens.application.contract.UpdateContractCommand;
import com.clauselens.interfaces.api.dto.ContractDetailResponse;
import com.clauselens.interfaces.api.dto.ContractResponse;
import com.clauselens.interfaces.api.dto.CreateContractRequest;
import com.clauselens.interfaces.api.dto.ProcessContractRequest;
import com.clauselens.interfaces.api.dto.UpdateContractRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
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

import java.util.List;

@RestController
@RequestMapping("/api/v1/contracts")
@RequiredArgsConstructor
public class ContractController {

    private final ContractAppService contractAppService;

    @PostMapping
    public ResponseEntity<ContractResponse> create(@Valid @RequestBody CreateContractRequest request) {
        var contract = contractAppService.create(new CreateContractCommand(
                request.orgId(), request.filename(), request.name(),
                Boolean.TRUE.equals(request.isTemplate()), request.templateType(), request.text()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ContractResponse.from(contract));
    }

    @PostMapping("/{id}/process")
    public ResponseEntity<ContractDetailResponse> process(@PathVariable String id,
                                                          @Valid @RequestBody(required = false) ProcessContractRequest request) {
        String text = request != null ? request.text() : null;
        return ResponseEntity.ok(ContractDetailResponse.from(contractAppService.process(id, text)));
    }

    @GetMapping
    public ResponseEntity<List<ContractResponse>> list(@RequestParam(required = false) String orgId,
                                                       @RequestParam(required = false) Boolean isTemplate) {
        return ResponseEntity.ok(contractAppService.list(orgId, isTemplate).stream()
                .map(ContractResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContractDetailResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(ContractDetailResponse.from(contractAppService.get(id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ContractResponse> update(@PathVariable String id,
                                                   @Valid @RequestBody UpdateContractRequest request) {
        var contract = contractAppService.update(id,
                new UpdateContractCommand(request.name(), request.isTemplate(), request.templateType()));
        return ResponseEntity.ok(ContractResponse.from(contract));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        contractAppService.delete(id);
        return ResponseEntity.noContent().build();
    }
}

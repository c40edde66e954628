package com.clauselens.application.contract;

import com.clauselens.application.contract.exception.ContractAlreadyProcessedException;
import com.clauselens.application.contract.exception.ContractInUseException;
import com.clauselens.application.contract.exception.ContractNotFoundException;
import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.repository.ClauseRepository;
import com.clauselens.domain.contract.repository.ContractRepository;
import com.clauselens.infrastructure.analysis.extraction.ClauseExtractor;
import com.clauselens.infrastructure.analysis.pipeline.ContractClauseWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.clauselens.application.common.InputSanitizer.sanitize;
import static com.clauselens.application.common.InputSanitizer.sanitizeOptional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContractAppService {

    private final ContractRepository contractRepository;
    private final ClauseRepository clauseRepository;
    private final ComparisonRepository comparisonRepository;
    private final ClauseExtractor clauseExtractor;
    private final ContractClauseWriter clauseWriter;

    @Value("${comparison.default-org-id:demo-org}")
    private String defaultOrgId;

    @Transactional
    public Contract create(CreateContractCommand command) {
        String filename = sanitizeOptional(command.filename());
        if (filename == null) {
            throw new IllegalArgumentException("Filename is required");
        }
        Contract contract = contractRepository.save(Contract.builder()
                .orgId(resolveOrgId(command.orgId()))
                .filename(filename)
                .name(sanitizeOptional(command.name()))
                .rawText(sanitizeOptional(command.text()))
                .template(command.template())
                .templateType(sanitizeOptional(command.templateType()))
                .build());
        log.info("[Contract] Created {} - orgId: {}, template: {}", contract.getId(), contract.getOrgId(), contract.isTemplate());
        return contract;
    }

    /**
     * Extracts and stores the clauses of a contract synchronously, replacing the clauses of an
     * earlier failed attempt. Uses the given text, or the stored text when none is given. The
     * contract is marked failed when extraction fails. Completed contracts are rejected, their
     * clauses may be referenced by comparison results.
     */
    public ContractDetail process(String contractId, String text) {
        Contract contract = findContract(contractId);
        if (contract.isCompleted()) {
            throw new ContractAlreadyProcessedException(contractId);
        }
        String contractText = text != null ? sanitize(text) : contract.getRawText();
        if (contractText == null || contractText.isBlank()) {
            throw new IllegalArgumentException("Contract text is required");
        }

        clauseWriter.markProcessing(contractId, contractText);
        List<Clause> clauses;
        try {
            List<ExtractedClause> extracted = clauseExtractor.extract(contractText);
            clauses = clauseWriter.replaceClauses(contractId, extracted);
        } catch (RuntimeException e) {
            log.warn("[Contract] Processing of {} failed: {}", contractId, e.getMessage());
            clauseWriter.markFailed(List.of(contractId));
            throw e;
        }
        return new ContractDetail(findContract(contractId), clauses);
    }

    @Transactional(readOnly = true)
    public List<Contract> list(String orgId, Boolean template) {
        String resolved = resolveOrgId(orgId);
        return template == null
                ? contractRepository.findByOrgIdOrderByUploadedAtDesc(resolved)
                : contractRepository.findByOrgIdAndTemplateOrderByUploadedAtDesc(resolved, template);
    }

    @Transactional(readOnly = true)
    public ContractDetail get(String contractId) {
        Contract contract = findContract(contractId);
        return new ContractDetail(contract, clauseRepository.findByContractId(contractId));
    }

    @Transactional
    public Contract update(String contractId, UpdateContractCommand command) {
        Contract contract = findContract(contractId);
        if (command.name() != null) {
            String name = sanitizeOptional(command.name());
            if (name == null) {
                throw new IllegalArgumentException("Contract name must not be blank");
            }
            contract.rename(name);
        }
        if (command.template() != null || command.templateType() != null) {
            boolean template = command.template() != null ? command.template() : contract.isTemplate();
            String templateType = command.templateType() != null
                    ? sanitizeOptional(command.templateType())
                    : contract.getTemplateType();
            contract.changeTemplate(template, templateType);
        }
        return contract;
    }

    @Transactional
    public void delete(String contractId) {
        findContract(contractId);
        if (comparisonRepository.existsBySourceContractIdOrTargetContractId(contractId, contractId)) {
            throw new ContractInUseException(contractId);
        }
        clauseRepository.deleteByContractId(contractId);
        contractRepository.deleteById(contractId);
        log.info("[Contract] Deleted {}", contractId);
    }

    private String resolveOrgId(String orgId) {
        String cleaned = sanitizeOptional(orgId);
        return cleaned != null ? cleaned : defaultOrgId;
    }

    private Contract findContract(String contractId) {
        return contractRepository.findById(contractId)
                .orElseThrow(() -> new ContractNotFoundException(contractId));
    }
}

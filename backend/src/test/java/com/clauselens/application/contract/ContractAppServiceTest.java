package com.clauselens.application.contract;

import com.clauselens.application.contract.exception.ContractAlreadyProcessedException;
import com.clauselens.application.contract.exception.ContractInUseException;
import com.clauselens.application.contract.exception.ContractNotFoundException;
import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.analysis.service.ReasoningServiceException;
import com.clauselens.domain.comparison.repository.ComparisonRepository;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.ClauseType;
import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.repository.ClauseRepository;
import com.clauselens.domain.contract.repository.ContractRepository;
import com.clauselens.infrastructure.analysis.extraction.ClauseExtractor;
import com.clauselens.infrastructure.analysis.pipeline.ContractClauseWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractAppServiceTest {

    @Mock
    private ContractRepository contractRepository;

    @Mock
    private ClauseRepository clauseRepository;

    @Mock
    private ComparisonRepository comparisonRepository;

    @Mock
    private ClauseExtractor clauseExtractor;

    @Mock
    private ContractClauseWriter clauseWriter;

    private ContractAppService service;
    private Contract contract;

    @BeforeEach
    void setUp() {
        service = new ContractAppService(contractRepository, clauseRepository, comparisonRepository,
                clauseExtractor, clauseWriter);
        ReflectionTestUtils.setField(service, "defaultOrgId", "demo-org");
        contract = Contract.builder().orgId("acme").filename("nda.pdf").rawText("Stored NDA text").build();
    }

    @Test
    @DisplayName("create derives name and content type from the filename")
    void create() {
        when(contractRepository.save(any(Contract.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Contract created = service.create(new CreateContractCommand(null, "Mutual NDA.docx", null, true, "nda", null));

        assertThat(created.getOrgId()).isEqualTo("demo-org");
        assertThat(created.getName()).isEqualTo("Mutual NDA");
        assertThat(created.getContentType())
                .isEqualTo("application/vnd.openxmlformats-officedocument.wordprocessingml.document");
        assertThat(created.isTemplate()).isTrue();
        assertThat(created.getTemplateType()).isEqualTo("nda");
    }

    @Test
    @DisplayName("create without a filename is rejected")
    void createWithoutFilename() {
        assertThatThrownBy(() -> service.create(new CreateContractCommand("acme", " ", null, false, null, "text")))
                .isInstanceOf(IllegalArgumentException.class);
        verify(contractRepository, never()).save(any());
    }

    @Test
    @DisplayName("process falls back to the stored text and replaces the clauses")
    void processStoredText() {
        List<ExtractedClause> extracted = List.of(
                new ExtractedClause(ClauseType.CONFIDENTIALITY, "1. Confidentiality", "Keep it secret.", 1, 0.9));
        Clause stored = Clause.builder().contractId(contract.getId()).clauseType(ClauseType.CONFIDENTIALITY)
                .content("Keep it secret.").build();
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(clauseExtractor.extract("Stored NDA text")).thenReturn(extracted);
        when(clauseWriter.replaceClauses(contract.getId(), extracted)).thenReturn(List.of(stored));

        ContractDetail detail = service.process(contract.getId(), null);

        verify(clauseWriter).markProcessing(contract.getId(), "Stored NDA text");
        assertThat(detail.clauses()).containsExactly(stored);
    }

    @Test
    @DisplayName("a failed extraction marks the contract failed and propagates")
    void processFailure() {
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(clauseExtractor.extract(anyString())).thenThrow(new ReasoningServiceException("upstream 529"));

        assertThatThrownBy(() -> service.process(contract.getId(), "New text"))
                .isInstanceOf(ReasoningServiceException.class);

        verify(clauseWriter).markProcessing(contract.getId(), "New text");
        verify(clauseWriter).markFailed(List.of(contract.getId()));
    }

    @Test
    @DisplayName("a completed contract cannot be processed again")
    void processCompleted() {
        contract.markCompleted();
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));

        assertThatThrownBy(() -> service.process(contract.getId(), "Rewritten NDA text"))
                .isInstanceOf(ContractAlreadyProcessedException.class);

        assertThat(contract.getRawText()).isEqualTo("Stored NDA text");
        verify(clauseWriter, never()).markProcessing(anyString(), any());
        verify(clauseWriter, never()).replaceClauses(anyString(), any());
        verify(clauseExtractor, never()).extract(anyString());
    }

    @Test
    @DisplayName("process without any text is rejected")
    void processWithoutText() {
        Contract empty = Contract.builder().orgId("acme").filename("empty.txt").build();
        when(contractRepository.findById(empty.getId())).thenReturn(Optional.of(empty));

        assertThatThrownBy(() -> service.process(empty.getId(), null)).isInstanceOf(IllegalArgumentException.class);
        verify(clauseWriter, never()).markProcessing(anyString(), any());
    }

    @Test
    @DisplayName("update renames and changes the template flag")
    void update() {
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));

        Contract updated = service.update(contract.getId(), new UpdateContractCommand("Vendor NDA", true, null));

        assertThat(updated.getName()).isEqualTo("Vendor NDA");
        assertThat(updated.isTemplate()).isTrue();
    }

    @Test
    @DisplayName("list filters by template flag only when given")
    void list() {
        service.list(null, null);
        service.list("acme", false);

        verify(contractRepository).findByOrgIdOrderByUploadedAtDesc("demo-org");
        verify(contractRepository).findByOrgIdAndTemplateOrderByUploadedAtDesc("acme", false);
    }

    @Test
    @DisplayName("a contract referenced by a comparison cannot be deleted")
    void deleteInUse() {
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(comparisonRepository.existsBySourceContractIdOrTargetContractId(contract.getId(), contract.getId()))
                .thenReturn(true);

        assertThatThrownBy(() -> service.delete(contract.getId())).isInstanceOf(ContractInUseException.class);
        verify(contractRepository, never()).deleteById(anyString());
    }

    @Test
    @DisplayName("an unknown contract is not found")
    void notFound() {
        when(contractRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get("nope")).isInstanceOf(ContractNotFoundException.class);
    }
}

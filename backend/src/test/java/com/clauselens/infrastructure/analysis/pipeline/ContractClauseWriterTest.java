package com.clauselens.infrastructure.analysis.pipeline;

import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.ClauseType;
import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.model.IngestionStatus;
import com.clauselens.domain.contract.repository.ClauseRepository;
import com.clauselens.domain.contract.repository.ContractRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractClauseWriterTest {

    @Mock
    private ContractRepository contractRepository;

    @Mock
    private ClauseRepository clauseRepository;

    @Captor
    private ArgumentCaptor<List<Clause>> savedClauses;

    private ContractClauseWriter writer;
    private Contract contract;

    @BeforeEach
    void setUp() {
        writer = new ContractClauseWriter(contractRepository, clauseRepository);
        contract = Contract.builder().orgId("acme").filename("msa.pdf").rawText("MSA text").build();
    }

    @Test
    @DisplayName("replacing clauses stores the batch and completes the contract")
    void replaceClauses() {
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(clauseRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        List<Clause> stored = writer.replaceClauses(contract.getId(), List.of(
                new ExtractedClause(ClauseType.PAYMENT_TERMS, "2. Fees", "Fees are due in 30 days.", 2, 0.8)));

        verify(clauseRepository).deleteByContractId(contract.getId());
        assertThat(stored).singleElement().satisfies(clause -> {
            assertThat(clause.getContractId()).isEqualTo(contract.getId());
            assertThat(clause.getTitle()).isEqualTo("2. Fees");
        });
        assertThat(contract.getIngestionStatus()).isEqualTo(IngestionStatus.COMPLETED);
    }

    @Test
    @DisplayName("over-long titles are cut to the column length")
    void longTitle() {
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(clauseRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        String title = "Limitation of liability ".repeat(40);

        writer.replaceClauses(contract.getId(), List.of(
                new ExtractedClause(ClauseType.LIMITATION_OF_LIABILITY, title, "Liability is capped.", null, 0.7)));

        verify(clauseRepository).saveAll(savedClauses.capture());
        String stored = savedClauses.getValue().get(0).getTitle();
        assertThat(stored).hasSize(Clause.TITLE_MAX_LENGTH).endsWith("...");
        assertThat(title).startsWith(stored.substring(0, Clause.TITLE_MAX_LENGTH - 3));
    }

    @Test
    @DisplayName("a completed contract keeps its stored clauses")
    void completedContractUntouched() {
        contract.markCompleted();
        Clause existing = Clause.builder().contractId(contract.getId()).clauseType(ClauseType.PAYMENT_TERMS)
                .content("Fees are due in 30 days.").build();
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(clauseRepository.findByContractId(contract.getId())).thenReturn(List.of(existing));

        List<Clause> clauses = writer.replaceClauses(contract.getId(), List.of(
                new ExtractedClause(ClauseType.PAYMENT_TERMS, "Fees", "Fees are due in 60 days.", 1, 0.9)));

        assertThat(clauses).containsExactly(existing);
        verify(clauseRepository, never()).deleteByContractId(anyString());
        verify(clauseRepository, never()).saveAll(anyList());
    }
}

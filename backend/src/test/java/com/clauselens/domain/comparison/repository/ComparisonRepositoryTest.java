package com.clauselens.domain.comparison.repository;

import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.model.ComparisonStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ComparisonRepositoryTest {

    @Autowired
    private ComparisonRepository comparisonRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Comparison saveProcessing() {
        return comparisonRepository.saveAndFlush(Comparison.builder()
                .orgId("acme").name("MSA").sourceContractId("s").targetContractId("t").build());
    }

    private int claim(String id, String owner, LocalDateTime now) {
        return comparisonRepository.claim(id, owner, ComparisonStatus.PROCESSING, now, now.plusMinutes(10));
    }

    @Test
    @DisplayName("only one worker can hold a live lease")
    void exclusiveClaim() {
        Comparison comparison = saveProcessing();
        LocalDateTime now = LocalDateTime.now();

        assertThat(claim(comparison.getId(), "worker-a", now)).isEqualTo(1);
        assertThat(claim(comparison.getId(), "worker-b", now)).isZero();

        Comparison reloaded = comparisonRepository.findById(comparison.getId()).orElseThrow();
        assertThat(reloaded.getLeaseOwner()).isEqualTo("worker-a");
        assertThat(reloaded.getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("an expired lease can be taken over")
    void takeOverExpiredLease() {
        Comparison comparison = saveProcessing();
        LocalDateTime now = LocalDateTime.now();
        claim(comparison.getId(), "worker-a", now);

        assertThat(claim(comparison.getId(), "worker-b", now.plusMinutes(11))).isEqualTo(1);
        assertThat(comparisonRepository.renewLease(comparison.getId(), "worker-a", ComparisonStatus.PROCESSING,
                now.plusMinutes(30))).isZero();
        assertThat(comparisonRepository.renewLease(comparison.getId(), "worker-b", ComparisonStatus.PROCESSING,
                now.plusMinutes(30))).isEqualTo(1);
        assertThat(comparisonRepository.findById(comparison.getId()).orElseThrow().getAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("terminal comparisons cannot be claimed")
    void terminalNotClaimable() {
        Comparison comparison = Comparison.builder().orgId("acme").sourceContractId("s").targetContractId("t").build();
        comparison.fail("boom");
        comparisonRepository.saveAndFlush(comparison);

        assertThat(claim(comparison.getId(), "worker-a", LocalDateTime.now())).isZero();
    }

    @Test
    @DisplayName("releasing a lease frees the row without counting the attempt")
    void release() {
        Comparison comparison = saveProcessing();
        claim(comparison.getId(), "worker-a", LocalDateTime.now());

        assertThat(comparisonRepository.releaseLease(comparison.getId(), "worker-a")).isEqualTo(1);

        Comparison reloaded = comparisonRepository.findById(comparison.getId()).orElseThrow();
        assertThat(reloaded.getLeaseOwner()).isNull();
        assertThat(reloaded.getAttempts()).isZero();
    }

    @Test
    @DisplayName("the recovery query returns unowned processing rows only")
    void claimableIds() {
        Comparison unowned = saveProcessing();
        Comparison leased = saveProcessing();
        Comparison finished = Comparison.builder().orgId("acme").sourceContractId("s").targetContractId("t").build();
        finished.complete(10, "done", List.of());
        comparisonRepository.saveAndFlush(finished);
        LocalDateTime now = LocalDateTime.now();
        claim(leased.getId(), "worker-a", now);

        List<String> ids = comparisonRepository.findClaimableIds(ComparisonStatus.PROCESSING, now, PageRequest.of(0, 10));

        assertThat(ids).containsExactly(unowned.getId());
    }

    @Test
    @DisplayName("status views are scoped to the organization")
    void statusViews() {
        Comparison comparison = saveProcessing();
        Comparison foreign = comparisonRepository.saveAndFlush(Comparison.builder()
                .orgId("other").sourceContractId("s").targetContractId("t").build());

        List<ComparisonStatusView> views = comparisonRepository.findStatusViewsByOrgIdAndIdIn("acme",
                List.of(comparison.getId(), foreign.getId()));

        assertThat(views).singleElement().satisfies(view -> {
            assertThat(view.getId()).isEqualTo(comparison.getId());
            assertThat(view.getStatus()).isEqualTo(ComparisonStatus.PROCESSING);
        });
    }

    @Test
    @DisplayName("a new comparison is persisted in place and loaded rows are not new")
    void persistsNewInstance() {
        Comparison comparison = Comparison.builder().orgId("acme").sourceContractId("s").targetContractId("t").build();
        assertThat(comparison.isNew()).isTrue();

        Comparison saved = comparisonRepository.saveAndFlush(comparison);

        assertThat(saved).isSameAs(comparison);
        assertThat(saved.isNew()).isFalse();
        entityManager.clear();
        assertThat(comparisonRepository.findById(comparison.getId()).orElseThrow().isNew()).isFalse();
    }
}

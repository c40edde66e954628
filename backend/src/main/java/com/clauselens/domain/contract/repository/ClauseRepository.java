package com.clauselens.domain.contract.repository;

import com.clauselens.domain.contract.model.Clause;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ClauseRepository extends JpaRepository<Clause, String> {

    List<Clause> findByContractId(String contractId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Clause c where c.contractId = :contractId")
    int deleteByContractId(@Param("contractId") String contractId);
}

package com.clauselens.domain.contract.repository;

import com.clauselens.domain.contract.model.Contract;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ContractRepository extends JpaRepository<Contract, String> {

    List<Contract> findByOrgIdOrderByUploadedAtDesc(String orgId);

    List<Contract> findByOrgIdAndTemplateOrderByUploadedAtDesc(String orgId, boolean template);
}

package com.clauselens.domain.comparison.repository;

import com.clauselens.domain.comparison.model.ClauseComparison;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ClauseComparisonRepository extends JpaRepository<ClauseComparison, String> {

    List<ClauseComparison> findByComparisonIdOrderByClauseType(String comparisonId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ClauseComparison cc where cc.comparisonId = :comparisonId")
    int deleteByComparisonId(@Param("comparisonId") String comparisonId);
}

package com.alcance.backend.repository;

import com.alcance.backend.domain.SearchKeyword;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SearchKeywordRepository extends JpaRepository<SearchKeyword, UUID> {

    List<SearchKeyword> findByActiveTrueOrderByPriorityDesc(Pageable pageable);

    List<SearchKeyword> findAllByOrderByPriorityDesc();
}

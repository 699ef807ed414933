package com.yizhaoqi.kb.repository;

import com.yizhaoqi.kb.model.KnowledgeBase;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface KnowledgeBaseRepository extends JpaRepository<KnowledgeBase, Long> {

    Page<KnowledgeBase> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}

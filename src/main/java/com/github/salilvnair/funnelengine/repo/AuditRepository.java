package com.github.salilvnair.funnelengine.repo;

import com.github.salilvnair.funnelengine.entity.FeAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditRepository extends JpaRepository<FeAudit, Long> {

    List<FeAudit> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);
}

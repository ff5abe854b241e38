package com.github.salilvnair.funnelengine.repo;

import com.github.salilvnair.funnelengine.entity.FeMessage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<FeMessage, Long> {

    List<FeMessage> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);
}

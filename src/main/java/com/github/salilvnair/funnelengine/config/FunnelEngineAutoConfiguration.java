package com.github.salilvnair.funnelengine.config;

import com.github.salilvnair.funnelengine.audit.AuditService;
import com.github.salilvnair.funnelengine.audit.DbAuditService;
import com.github.salilvnair.funnelengine.guard.SideEffectGuard;
import com.github.salilvnair.funnelengine.repo.AuditRepository;
import com.github.salilvnair.funnelengine.repo.ConversationRepository;
import com.github.salilvnair.funnelengine.repo.MessageRepository;
import com.github.salilvnair.funnelengine.repo.ResourceRepository;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import com.github.salilvnair.funnelengine.spi.MessageDelivery;
import com.github.salilvnair.funnelengine.spi.ResourceDirectory;
import com.github.salilvnair.funnelengine.store.JpaConversationStore;
import com.github.salilvnair.funnelengine.store.JpaResourceDirectory;
import com.github.salilvnair.funnelengine.store.UnconfiguredMessageDelivery;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Collaborator beans are only defaults; a host that defines its own {@link ConversationStore},
 * {@link ResourceDirectory}, {@link MessageDelivery}, {@link AuditService} or {@link Clock}
 * replaces them.
 */
@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.funnelengine")
@ComponentScan(basePackages = "com.github.salilvnair.funnelengine")
@EntityScan(basePackages = "com.github.salilvnair.funnelengine.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.funnelengine.repo")
public class FunnelEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock funnelEngineClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversationStore conversationStore(ConversationRepository conversationRepository,
                                               MessageRepository messageRepository,
                                               PlatformTransactionManager transactionManager) {
        return new JpaConversationStore(conversationRepository, messageRepository, new TransactionTemplate(transactionManager));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceDirectory resourceDirectory(ResourceRepository resourceRepository) {
        return new JpaResourceDirectory(resourceRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageDelivery messageDelivery() {
        return new UnconfiguredMessageDelivery();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditService auditService(AuditRepository auditRepository, Clock clock) {
        return new DbAuditService(auditRepository, clock);
    }

    @Bean(name = SideEffectGuard.ACTION_EXECUTOR_BEAN, destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = SideEffectGuard.ACTION_EXECUTOR_BEAN)
    public ExecutorService funnelEngineActionExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("fe-action-"));
    }
}

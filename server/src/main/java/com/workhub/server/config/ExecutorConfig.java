package com.workhub.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pools for the hub's blocking work. Storage, history loading and agent
 * hand-off each get their own pool so a slow dependency cannot starve the
 * others.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${hub.persistence.threads:8}")
    private int persistenceThreads;

    @Value("${hub.history.threads:4}")
    private int historyThreads;

    @Value("${hub.agent.threads:2}")
    private int agentThreads;

    @Bean(name = "persistenceExecutor", destroyMethod = "shutdown")
    public ExecutorService persistenceExecutor() {
        log.info("Creating persistence executor with {} threads", persistenceThreads);
        return Executors.newFixedThreadPool(persistenceThreads, namedThreads("hub-persist-"));
    }

    @Bean(name = "historyExecutor", destroyMethod = "shutdown")
    public ExecutorService historyExecutor() {
        log.info("Creating history executor with {} threads", historyThreads);
        return Executors.newFixedThreadPool(historyThreads, namedThreads("hub-history-"));
    }

    @Bean(name = "agentExecutor", destroyMethod = "shutdown")
    public ExecutorService agentExecutor() {
        return Executors.newFixedThreadPool(agentThreads, namedThreads("hub-agent-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicLong counter = new AtomicLong(0);
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

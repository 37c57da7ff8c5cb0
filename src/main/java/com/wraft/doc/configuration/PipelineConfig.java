package com.wraft.doc.configuration;

import com.google.common.util.concurrent.Striped;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.locks.Lock;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One lock per instance code, held from workspace preparation until the renderer exits.
     */
    @Bean(name = "buildLocks")
    public Striped<Lock> buildLocks() {
        return Striped.lazyWeakLock(64);
    }

    /**
     * One lock per counter subject, held until the increment is committed.
     */
    @Bean(name = "counterLocks")
    public Striped<Lock> counterLocks() {
        return Striped.lazyWeakLock(32);
    }
}

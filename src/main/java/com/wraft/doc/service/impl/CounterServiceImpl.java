package com.wraft.doc.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.Counter;
import com.wraft.doc.repository.CounterRepository;
import com.wraft.doc.service.CounterService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.LongFunction;

/**
 * Serialized counter increments.
 *
 * Callers in this JVM queue on a striped lock per subject. Each increment runs in
 * its own transaction together with the caller's action and reads the row with a
 * pessimistic write lock, which also orders callers on other nodes. A failing action
 * rolls the increment back. Two first-time callers on different nodes can both try
 * to insert the row; the loser hits the unique constraint and retries against the
 * row the winner created.
 */
@Slf4j
@Service
public class CounterServiceImpl implements CounterService {

    private static final int MAX_ATTEMPTS = 3;

    private final CounterRepository counterRepository;
    private final TransactionTemplate transactionTemplate;
    private final Striped<Lock> counterLocks;

    public CounterServiceImpl(CounterRepository counterRepository,
                              PlatformTransactionManager transactionManager,
                              @Qualifier("counterLocks") Striped<Lock> counterLocks) {
        this.counterRepository = counterRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.counterLocks = counterLocks;
    }

    @Override
    public <T> T next(ContentType contentType, LongFunction<T> action) {
        Preconditions.checkNotNull(contentType, "contentType");
        Preconditions.checkNotNull(action, "action");
        Preconditions.checkArgument(contentType.getId() != null, "Content type must be persisted before it is counted");

        String subject = Counter.subjectFor(contentType);
        Lock lock = counterLocks.get(subject);
        lock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                AtomicBoolean counted = new AtomicBoolean();
                try {
                    return transactionTemplate.execute(status -> {
                        long value = increment(subject);
                        counted.set(true);
                        log.debug("Counter {} advanced to {}", subject, value);
                        return action.apply(value);
                    });
                } catch (DataIntegrityViolationException e) {
                    // Only a concurrent first insert of the counter row is worth another try
                    if (counted.get() || attempt >= MAX_ATTEMPTS) {
                        throw e;
                    }
                    log.warn("Counter {} was created concurrently, retrying (attempt {}/{})", subject, attempt, MAX_ATTEMPTS);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private long increment(String subject) {
        Counter counter = counterRepository.findBySubjectForUpdate(subject)
                .orElseGet(() -> Counter.builder().subject(subject).count(0).build());
        counter.setCount(counter.getCount() + 1);
        counterRepository.saveAndFlush(counter);
        return counter.getCount();
    }
}

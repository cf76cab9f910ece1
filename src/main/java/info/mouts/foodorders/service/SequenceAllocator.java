package info.mouts.foodorders.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.foodorders.domain.OrderCounter;
import info.mouts.foodorders.repository.OrderCounterRepository;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands out consecutive order numbers from the {@link OrderCounter} row.
 * <p>
 * {@link #allocateNext()} joins the caller's transaction and refuses to run
 * without one, so the counter increment commits or rolls back together with
 * whatever the caller writes next. A concurrent allocation surfaces as a
 * {@link org.springframework.dao.ConcurrencyFailureException} (stale version)
 * or a {@link org.springframework.dao.DataIntegrityViolationException} (two
 * first inserts); retrying is up to the caller.
 * </p>
 */
@Component
@Slf4j
public class SequenceAllocator {
    private final OrderCounterRepository counterRepository;

    /**
     * Constructs an instance of {@code SequenceAllocator}.
     *
     * @param counterRepository The repository holding the counter row.
     */
    public SequenceAllocator(OrderCounterRepository counterRepository) {
        this.counterRepository = counterRepository;
    }

    /**
     * Reads the counter, increments it and writes it back.
     *
     * @return the newly allocated number, 1 for the very first order
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long allocateNext() {
        OrderCounter counter = counterRepository.findById(OrderCounter.ORDERS)
                .orElseGet(() -> OrderCounter.builder().id(OrderCounter.ORDERS).value(0L).build());

        long next = counter.getValue() + 1;
        counter.setValue(next);
        counterRepository.saveAndFlush(counter);

        log.debug("Allocated order number {}", next);
        return next;
    }

    /**
     * Returns the last allocated number without changing it.
     *
     * @return the current counter value, 0 when nothing was allocated yet
     */
    @Transactional(readOnly = true)
    public long peek() {
        return counterRepository.findById(OrderCounter.ORDERS)
                .map(OrderCounter::getValue)
                .orElse(0L);
    }
}

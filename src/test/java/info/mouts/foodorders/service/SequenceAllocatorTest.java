package info.mouts.foodorders.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.foodorders.domain.OrderCounter;
import info.mouts.foodorders.repository.OrderCounterRepository;

@DataJpaTest
@Import(SequenceAllocator.class)
public class SequenceAllocatorTest {
    @Autowired
    private SequenceAllocator sequenceAllocator;

    @Autowired
    private OrderCounterRepository counterRepository;

    @Test
    void testFirstAllocationStartsAtOne() {
        assertEquals(0L, sequenceAllocator.peek());
        assertEquals(1L, sequenceAllocator.allocateNext());
        assertEquals(2L, sequenceAllocator.allocateNext());
        assertEquals(2L, sequenceAllocator.peek());
    }

    @Test
    void testContinuesFromStoredValue() {
        counterRepository.saveAndFlush(OrderCounter.builder().id(OrderCounter.ORDERS).value(41L).build());

        assertEquals(42L, sequenceAllocator.allocateNext());
        assertEquals(42L, counterRepository.findById(OrderCounter.ORDERS).orElseThrow().getValue());
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void testRefusesToRunOutsideATransaction() {
        assertThrows(IllegalTransactionStateException.class, () -> sequenceAllocator.allocateNext());
    }
}

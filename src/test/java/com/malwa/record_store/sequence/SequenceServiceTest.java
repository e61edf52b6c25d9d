package com.malwa.record_store.sequence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for per-prefix sequences and display codes.
 */
@SpringBootTest
class SequenceServiceTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",
                () -> "jdbc:h2:mem:sequence_service_test;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    }

    @Autowired
    private SequenceService sequenceService;

    @Test
    @DisplayName("First code for a fresh prefix is INV-001 and the fifteenth is INV-015")
    void testGenerateCode() {
        assertEquals("INV-001", sequenceService.generateCode("INV"));

        String last = null;
        for (int i = 2; i <= 15; i++) {
            last = sequenceService.generateCode("INV");
        }

        assertEquals("INV-015", last);
        assertEquals(15, sequenceService.currentValue("INV"));
    }

    @Test
    @DisplayName("Sequences increase by one and are independent per prefix")
    void testNextSequence_PerPrefix() {
        assertEquals(1, sequenceService.nextSequence("EST"));
        assertEquals(2, sequenceService.nextSequence("EST"));
        assertEquals(1, sequenceService.nextSequence("JOB"));
        assertEquals(3, sequenceService.nextSequence("EST"));
        assertEquals(1, sequenceService.currentValue("JOB"));
    }

    @Test
    @DisplayName("currentValue is zero for an unused prefix and does not issue a value")
    void testCurrentValue_Unused() {
        assertEquals(0, sequenceService.currentValue("UNUSED"));
        assertEquals(0, sequenceService.currentValue("UNUSED"));
        assertEquals(1, sequenceService.nextSequence("UNUSED"));
    }

    @Test
    @DisplayName("Width pads short numbers and never truncates long ones")
    void testGenerateCode_Width() {
        assertEquals("CH-00001", sequenceService.generateCode("CH", 5));
        assertEquals("CH-2", sequenceService.generateCode("CH", 1));
        assertThrows(IllegalArgumentException.class, () -> sequenceService.generateCode("CH", 0));
    }

    @Test
    @DisplayName("Blank prefixes are rejected")
    void testBlankPrefix() {
        assertThrows(IllegalArgumentException.class, () -> sequenceService.nextSequence(" "));
        assertThrows(IllegalArgumentException.class, () -> sequenceService.nextSequence(null));
        assertThrows(IllegalArgumentException.class, () -> sequenceService.currentValue(""));
    }

    @Test
    @DisplayName("Concurrent callers never receive the same value and no value is skipped")
    void testNextSequence_Concurrent() throws InterruptedException {
        // Given: an existing counter
        assertEquals(1, sequenceService.nextSequence("PAR"));

        int threadCount = 8;
        int callsPerThread = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ConcurrentLinkedQueue<Long> issued = new ConcurrentLinkedQueue<>();
        AtomicInteger failures = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        // When: several threads draw values at once
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < callsPerThread; j++) {
                        issued.add(sequenceService.nextSequence("PAR"));
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        // Then: every value 2..81 was issued exactly once
        int total = threadCount * callsPerThread;
        assertEquals(0, failures.get());
        assertEquals(total, issued.size());
        Set<Long> distinct = new TreeSet<>(issued);
        assertEquals(total, distinct.size());
        List<Long> expected = new ArrayList<>();
        LongStream.rangeClosed(2, total + 1).forEach(expected::add);
        assertEquals(expected, new ArrayList<>(distinct));
        assertEquals(total + 1, sequenceService.currentValue("PAR"));
    }
}

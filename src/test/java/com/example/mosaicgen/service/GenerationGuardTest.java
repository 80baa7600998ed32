package com.example.mosaicgen.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GenerationGuardTest {

    @Test
    void shouldAllowOneHolderPerProject() {
        GenerationGuard guard = new GenerationGuard();

        assertTrue(guard.tryAcquire(7));
        assertFalse(guard.tryAcquire(7));
        assertTrue(guard.tryAcquire(8));
        assertTrue(guard.isActive(7));

        guard.release(7);

        assertFalse(guard.isActive(7));
        assertTrue(guard.tryAcquire(7));
    }

    @Test
    void shouldKeepSeparateStatePerInstance() {
        GenerationGuard first = new GenerationGuard();
        GenerationGuard second = new GenerationGuard();

        assertTrue(first.tryAcquire(1));
        assertTrue(second.tryAcquire(1));
    }
}

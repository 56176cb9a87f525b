package xyz.firestige.pipeline.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelfMutationBarrierTest {

    @Test
    void initialValue_followsSelfMutationSetting() {
        assertTrue(new SelfMutationBarrier(true).isBeforeSelfMutation());
        assertFalse(new SelfMutationBarrier(false).isBeforeSelfMutation());
    }

    @Test
    void clear_isPermanent() {
        SelfMutationBarrier barrier = new SelfMutationBarrier(true);
        barrier.clear();
        barrier.clear();

        assertFalse(barrier.isBeforeSelfMutation());
    }
}

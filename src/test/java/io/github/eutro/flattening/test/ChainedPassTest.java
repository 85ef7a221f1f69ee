package io.github.eutro.flattening.test;

import io.github.eutro.flattening.passes.IRPass;
import io.github.eutro.flattening.passes.InPlaceIRPass;
import io.github.eutro.flattening.passes.meta.VerifyIntegrity;
import io.github.eutro.flattening.ssa.Function;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChainedPassTest {
    @Test
    void testOrder() {
        List<Integer> ran = new ArrayList<>();
        IRPass<Function, Function> pass = ((InPlaceIRPass<Function>) f -> ran.add(1))
                .then((InPlaceIRPass<Function>) f -> ran.add(2))
                .then((InPlaceIRPass<Function>) f -> ran.add(3));
        assertTrue(pass.isInPlace());
        Function func = Programs.straightLine();
        assertSame(func, pass.run(func));
        assertEquals(Arrays.asList(1, 2, 3), ran);
    }

    @Test
    void testFailureNamesPass() {
        IRPass<Function, Function> pass = VerifyIntegrity.INSTANCE
                .then((InPlaceIRPass<Function>) f -> {
                    throw new IllegalStateException("bad");
                });
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> pass.run(Programs.straightLine()));
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("running pass 1"));
    }

    @Test
    void testMapping() {
        IRPass<Function, Integer> pass = VerifyIntegrity.INSTANCE
                .then(f -> f.blocks.size());
        assertFalse(pass.isInPlace());
        assertEquals(3, pass.run(Programs.straightLine()));
    }
}

package org.yulcfg;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BlockIdsTest {

    @Test
    void testIdsAreDenseAndStable() {
        BlockIds ids = new BlockIds();
        Cfg.BasicBlock a = new Cfg.BasicBlock();
        Cfg.BasicBlock b = new Cfg.BasicBlock();

        assertFalse(ids.contains(a));
        assertEquals(0, ids.idOf(a));
        assertEquals(1, ids.idOf(b));
        assertEquals(0, ids.idOf(a));
        assertTrue(ids.contains(b));
        assertEquals(2, ids.size());
    }

    @Test
    void testLabels() {
        BlockIds ids = new BlockIds();
        Cfg.BasicBlock a = new Cfg.BasicBlock();
        Cfg.BasicBlock b = new Cfg.BasicBlock();

        assertEquals("Block0Exit", ids.exitLabel(a));
        assertEquals("Block1", ids.label(b));
        assertEquals("Block0", ids.label(a));
    }

    @Test
    void testFreshInstanceStartsAtZero() {
        Cfg.BasicBlock a = new Cfg.BasicBlock();
        Cfg.BasicBlock b = new Cfg.BasicBlock();
        BlockIds first = new BlockIds();
        first.idOf(a);
        first.idOf(b);

        assertEquals(0, new BlockIds().idOf(b));
    }
}

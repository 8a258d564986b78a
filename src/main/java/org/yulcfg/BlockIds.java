package org.yulcfg;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Assigns dense ids (0, 1, 2, ...) to blocks on first encounter, keyed by reference.
 * One instance per export call; not thread-safe.
 */
public class BlockIds {
    private final Map<Cfg.BasicBlock, Integer> ids = new IdentityHashMap<>();
    private int blockCount = 0;

    public int idOf(Cfg.BasicBlock block) {
        Integer id = ids.get(block);
        if (id != null) return id;
        int fresh = blockCount++;
        ids.put(block, fresh);
        return fresh;
    }

    public boolean contains(Cfg.BasicBlock block) {
        return ids.containsKey(block);
    }

    /** "Block3" */
    public String label(Cfg.BasicBlock block) {
        return "Block" + idOf(block);
    }

    /** "Block3Exit" */
    public String exitLabel(Cfg.BasicBlock block) {
        return label(block) + "Exit";
    }

    public int size() {
        return blockCount;
    }
}

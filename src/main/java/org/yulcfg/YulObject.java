package org.yulcfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A named Yul object: its code's CFG plus nested sub-objects (e.g. "runtime"). */
public class YulObject {
    public final String name;
    public final Cfg cfg;
    public final List<YulObject> subObjects;

    public YulObject(String name, Cfg cfg, List<YulObject> subObjects) {
        this.name = Objects.requireNonNull(name);
        this.cfg = Objects.requireNonNull(cfg);
        this.subObjects = Collections.unmodifiableList(new ArrayList<>(subObjects));
    }

    public YulObject(String name, Cfg cfg) {
        this(name, cfg, List.of());
    }
}

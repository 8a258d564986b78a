package org.yulcfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Exports a {@link Cfg} as a flat JSON array of block and exit fragments.
 * <p>
 * Blocks are visited breadth-first, starting from the main entry followed by every
 * function entry. Each visited block emits its block fragment immediately followed by
 * its "Block&lt;n&gt;Exit" fragment; fragments refer to each other by id string only.
 * Back-edges are not marked, an already discovered block is just not traversed again.
 */
public class CfgJsonExporter {

    private final ObjectMapper om;

    public CfgJsonExporter(ObjectMapper om) {
        this.om = om;
    }

    public CfgJsonExporter() {
        this(new ObjectMapper());
    }

    public ArrayNode export(Cfg cfg) {
        ArrayNode ret = om.createArrayNode();
        BlockIds ids = new BlockIds();   // export 호출마다 새로
        CfgNodeEncoder encoder = new CfgNodeEncoder(om, ids);

        BreadthFirstSearch<Cfg.BasicBlock> bfs = new BreadthFirstSearch<>(cfg.entry);
        for (Cfg.FunctionInfo info : cfg.functionInfo.values()) {
            bfs.addRoot(info.entry);
        }

        bfs.run((block, addChild) -> {
            ret.add(encoder.block(block));
            ret.add(encoder.exit(block));
            // 후속 블록: Jump 는 target, ConditionalJump 는 zero -> nonZero 순
            block.getExit().accept(new Cfg.Exit.Visitor<Void>() {
                @Override public Void visitMainExit(Cfg.MainExit exit) { return null; }

                @Override public Void visitJump(Cfg.Jump exit) {
                    addChild.accept(exit.target);
                    return null;
                }

                @Override public Void visitConditionalJump(Cfg.ConditionalJump exit) {
                    addChild.accept(exit.zero);
                    addChild.accept(exit.nonZero);
                    return null;
                }

                @Override public Void visitFunctionReturn(Cfg.FunctionReturn exit) { return null; }

                @Override public Void visitTerminated(Cfg.Terminated exit) { return null; }
            });
        });
        return ret;
    }
}

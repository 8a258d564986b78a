package org.yulcfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Converts single CFG entities (block, exit, operation, stack slot) into JSON fragments.
 * Holds no traversal state; block ids are looked up through the {@link BlockIds} of
 * the current export.
 */
public class CfgNodeEncoder {

    private final ObjectMapper om;
    private final BlockIds ids;

    public CfgNodeEncoder(ObjectMapper om, BlockIds ids) {
        this.om = om;
        this.ids = ids;
    }

    /** { id, instructions, exit, type: "BasicBlock" } */
    public ObjectNode block(Cfg.BasicBlock block) {
        ObjectNode n = om.createObjectNode();
        n.put("id", ids.label(block));
        ArrayNode instructions = n.putArray("instructions");
        for (Cfg.Operation op : block.operations) {
            instructions.add(operation(op));
        }
        n.put("exit", ids.exitLabel(block));
        n.put("type", "BasicBlock");
        return n;
    }

    /**
     * Synthetic "Block&lt;n&gt;Exit" fragment. Kinds without a successor list the block itself.
     */
    public ObjectNode exit(Cfg.BasicBlock block) {
        ObjectNode n = om.createObjectNode();
        n.put("id", ids.exitLabel(block));
        ArrayNode instructions = n.putArray("instructions");

        block.getExit().accept(new Cfg.Exit.Visitor<Void>() {
            @Override public Void visitMainExit(Cfg.MainExit exit) {
                n.set("exit", labels(block));
                n.put("type", "MainExit");
                return null;
            }

            @Override public Void visitJump(Cfg.Jump exit) {
                n.set("exit", labels(exit.target));
                n.put("type", "Jump");
                return null;
            }

            @Override public Void visitConditionalJump(Cfg.ConditionalJump exit) {
                n.set("exit", labels(exit.zero, exit.nonZero));   // zero 먼저
                n.set("cond", slots(List.of(exit.condition)));
                n.put("type", "ConditionalJump");
                return null;
            }

            @Override public Void visitFunctionReturn(Cfg.FunctionReturn exit) {
                instructions.add(exit.info.function.name);
                n.set("exit", labels(block));
                n.put("type", "FunctionReturn");
                return null;
            }

            @Override public Void visitTerminated(Cfg.Terminated exit) {
                n.set("exit", labels(block));
                n.put("type", "Terminated");
                return null;
            }
        });
        return n;
    }

    public ObjectNode operation(Cfg.Operation operation) {
        ObjectNode n = om.createObjectNode();

        operation.kind.accept(new Cfg.OperationKind.Visitor<Void>() {
            @Override public Void visitFunctionCall(Cfg.FunctionCall call) {
                n.put("op", call.function.name);
                return null;
            }

            @Override public Void visitBuiltinCall(Cfg.BuiltinCall call) {
                ArrayNode builtinArgs = literalArguments(call);
                if (!builtinArgs.isEmpty())
                    n.set("builtinArgs", builtinArgs);
                n.put("op", call.callSite.functionName);
                return null;
            }

            @Override public Void visitAssignment(Cfg.Assignment assignment) {
                n.set("assignment", slots(assignment.variables));
                return null;
            }
        });

        n.set("in", slots(operation.input));
        n.set("out", slots(operation.output));
        return n;
    }

    /** Ordered textual rendering of a stack; empty array for an empty stack. */
    public ArrayNode slots(List<? extends StackSlot> stack) {
        ArrayNode arr = om.createArrayNode();
        for (StackSlot slot : stack) {
            arr.add(StackSlots.toString(slot));
        }
        return arr;
    }

    /**
     * Values of the call-site arguments at the builtin's literal-only positions.
     * Positions past the end of the call-site argument list are skipped.
     */
    ArrayNode literalArguments(Cfg.BuiltinCall call) {
        ArrayNode arr = om.createArrayNode();
        List<Optional<Ast.LiteralKind>> literalArgs = call.builtin.literalArguments;
        List<Ast.Expression> callArgs = call.callSite.arguments;
        for (int i = 0; i < literalArgs.size() && i < callArgs.size(); i++) {
            if (literalArgs.get(i).isEmpty()) continue;
            Ast.Expression arg = callArgs.get(i);
            YulAssertion.check(arg instanceof Ast.Literal,
                    "argument " + i + " of builtin " + call.builtin.name + " must be a literal, got: " + arg);
            arr.add(((Ast.Literal) arg).value);
        }
        return arr;
    }

    private ArrayNode labels(Cfg.BasicBlock... blocks) {
        ArrayNode arr = om.createArrayNode();
        for (Cfg.BasicBlock b : blocks) {
            arr.add(ids.label(b));
        }
        return arr;
    }
}

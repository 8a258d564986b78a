package org.yulcfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Control flow graph of one Yul object, as handed over by the CFG builder.
 * The builder wires blocks and exits; after that the graph is only read.
 */
public class Cfg {

    /** 메인 코드의 진입 블록 */
    public final BasicBlock entry;

    /** function -> info, 삽입 순서 = 함수 열거 순서 */
    public final Map<Ast.YulFunction, FunctionInfo> functionInfo = new LinkedHashMap<>();

    public Cfg(BasicBlock entry) {
        this.entry = Objects.requireNonNull(entry);
    }

    public FunctionInfo addFunction(FunctionInfo info) {
        if (functionInfo.putIfAbsent(info.function, info) != null)
            throw new IllegalArgumentException("function already defined: " + info.function.name);
        return info;
    }

    public static class FunctionInfo {
        public final Ast.YulFunction function;
        public final BasicBlock entry;
        public final List<StackSlot.VariableSlot> parameters;
        public final List<StackSlot.VariableSlot> returnVariables;
        public final boolean canContinue;

        public FunctionInfo(Ast.YulFunction function, BasicBlock entry,
                            List<StackSlot.VariableSlot> parameters,
                            List<StackSlot.VariableSlot> returnVariables,
                            boolean canContinue) {
            this.function = Objects.requireNonNull(function);
            this.entry = Objects.requireNonNull(entry);
            this.parameters = List.copyOf(parameters);
            this.returnVariables = List.copyOf(returnVariables);
            this.canContinue = canContinue;
        }

        public FunctionInfo(Ast.YulFunction function, BasicBlock entry) {
            this(function, entry, List.of(), List.of(), true);
        }
    }

    /**
     * Straight-line operations followed by exactly one exit.
     * Identity is reference identity: two blocks with equal contents are still two blocks.
     */
    public static class BasicBlock {
        public final List<Operation> operations = new ArrayList<>();
        private Exit exit = new MainExit();

        public BasicBlock add(Operation operation) {
            operations.add(Objects.requireNonNull(operation));
            return this;
        }

        public Exit getExit() { return exit; }

        public void setExit(Exit exit) { this.exit = Objects.requireNonNull(exit); }
    }

    // ---------------------------------------------------------------- exits

    public interface Exit {
        <R> R accept(Visitor<R> v);

        interface Visitor<R> {
            R visitMainExit(MainExit exit);
            R visitJump(Jump exit);
            R visitConditionalJump(ConditionalJump exit);
            R visitFunctionReturn(FunctionReturn exit);
            R visitTerminated(Terminated exit);
        }
    }

    /** 정상 종료 */
    public static class MainExit implements Exit {
        @Override public <R> R accept(Visitor<R> v) { return v.visitMainExit(this); }
    }

    public static class Jump implements Exit {
        public final BasicBlock target;
        /** true when the builder created this jump as a loop back-edge */
        public final boolean backwards;

        public Jump(BasicBlock target, boolean backwards) {
            this.target = Objects.requireNonNull(target);
            this.backwards = backwards;
        }

        public Jump(BasicBlock target) { this(target, false); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitJump(this); }
    }

    public static class ConditionalJump implements Exit {
        public final StackSlot condition;
        public final BasicBlock zero;
        public final BasicBlock nonZero;

        public ConditionalJump(StackSlot condition, BasicBlock zero, BasicBlock nonZero) {
            this.condition = Objects.requireNonNull(condition);
            this.zero = Objects.requireNonNull(zero);
            this.nonZero = Objects.requireNonNull(nonZero);
        }

        @Override public <R> R accept(Visitor<R> v) { return v.visitConditionalJump(this); }
    }

    public static class FunctionReturn implements Exit {
        public final FunctionInfo info;

        public FunctionReturn(FunctionInfo info) { this.info = Objects.requireNonNull(info); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitFunctionReturn(this); }
    }

    /** revert, invalid 등으로 비정상 종료 */
    public static class Terminated implements Exit {
        @Override public <R> R accept(Visitor<R> v) { return v.visitTerminated(this); }
    }

    // ----------------------------------------------------------- operations

    public static class Operation {
        public final List<StackSlot> input;
        public final List<StackSlot> output;
        public final OperationKind kind;

        public Operation(List<? extends StackSlot> input, List<? extends StackSlot> output, OperationKind kind) {
            this.input = Collections.unmodifiableList(new ArrayList<>(input));
            this.output = Collections.unmodifiableList(new ArrayList<>(output));
            this.kind = Objects.requireNonNull(kind);
        }

        @Override public String toString() {
            return StackSlots.toString(input) + " => " + StackSlots.toString(output) + " : " + kind;
        }
    }

    public interface OperationKind {
        <R> R accept(Visitor<R> v);

        interface Visitor<R> {
            R visitFunctionCall(FunctionCall call);
            R visitBuiltinCall(BuiltinCall call);
            R visitAssignment(Assignment assignment);
        }
    }

    public static class FunctionCall implements OperationKind {
        public final Ast.YulFunction function;
        public final Ast.FunctionCall callSite;
        public final boolean canContinue;

        public FunctionCall(Ast.YulFunction function, Ast.FunctionCall callSite, boolean canContinue) {
            this.function = Objects.requireNonNull(function);
            this.callSite = Objects.requireNonNull(callSite);
            this.canContinue = canContinue;
        }

        public FunctionCall(Ast.YulFunction function, Ast.FunctionCall callSite) {
            this(function, callSite, true);
        }

        @Override public <R> R accept(Visitor<R> v) { return v.visitFunctionCall(this); }
        @Override public String toString() { return "call " + function.name; }
    }

    public static class BuiltinCall implements OperationKind {
        public final Ast.BuiltinFunction builtin;
        public final Ast.FunctionCall callSite;
        /** number of call-site arguments that end up on the stack */
        public final int arguments;

        public BuiltinCall(Ast.BuiltinFunction builtin, Ast.FunctionCall callSite, int arguments) {
            this.builtin = Objects.requireNonNull(builtin);
            this.callSite = Objects.requireNonNull(callSite);
            this.arguments = arguments;
        }

        @Override public <R> R accept(Visitor<R> v) { return v.visitBuiltinCall(this); }
        @Override public String toString() { return "builtin " + callSite.functionName; }
    }

    public static class Assignment implements OperationKind {
        public final List<StackSlot.VariableSlot> variables;

        public Assignment(List<StackSlot.VariableSlot> variables) {
            this.variables = List.copyOf(variables);
        }

        @Override public <R> R accept(Visitor<R> v) { return v.visitAssignment(this); }
        @Override public String toString() { return "assign " + StackSlots.toString(variables); }
    }
}

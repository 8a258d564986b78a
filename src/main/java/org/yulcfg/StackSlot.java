package org.yulcfg;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A value-carrying location consumed or produced by a CFG operation.
 * Slots compare by value; rendering lives in {@link StackSlots}.
 */
public interface StackSlot {

    <R> R accept(Visitor<R> v);

    interface Visitor<R> {
        R visitVariable(VariableSlot slot);
        R visitLiteral(LiteralSlot slot);
        R visitTemporary(TemporarySlot slot);
        R visitFunctionCallReturnLabel(FunctionCallReturnLabelSlot slot);
        R visitFunctionReturnLabel(FunctionReturnLabelSlot slot);
        R visitJunk(JunkSlot slot);
    }

    /** 변수 (함수 인자/리턴 변수 포함) */
    final class VariableSlot implements StackSlot {
        public final String name;

        public VariableSlot(String name) { this.name = Objects.requireNonNull(name); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitVariable(this); }
        @Override public boolean equals(Object o) {
            return o instanceof VariableSlot && ((VariableSlot) o).name.equals(name);
        }
        @Override public int hashCode() { return name.hashCode(); }
        @Override public String toString() { return StackSlots.toString(this); }
    }

    final class LiteralSlot implements StackSlot {
        public final BigInteger value;

        public LiteralSlot(BigInteger value) {
            if (value.signum() < 0) throw new IllegalArgumentException("negative literal: " + value);
            this.value = value;
        }

        public LiteralSlot(long value) { this(BigInteger.valueOf(value)); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitLiteral(this); }
        @Override public boolean equals(Object o) {
            return o instanceof LiteralSlot && ((LiteralSlot) o).value.equals(value);
        }
        @Override public int hashCode() { return value.hashCode(); }
        @Override public String toString() { return StackSlots.toString(this); }
    }

    /** {@code index}-th return value of {@code call}, before it is bound to a variable */
    final class TemporarySlot implements StackSlot {
        public final Ast.FunctionCall call;
        public final int index;

        public TemporarySlot(Ast.FunctionCall call, int index) {
            this.call = Objects.requireNonNull(call);
            this.index = index;
        }

        @Override public <R> R accept(Visitor<R> v) { return v.visitTemporary(this); }
        // call site 는 참조 동일성으로 비교
        @Override public boolean equals(Object o) {
            return o instanceof TemporarySlot
                    && ((TemporarySlot) o).call == call
                    && ((TemporarySlot) o).index == index;
        }
        @Override public int hashCode() { return 31 * System.identityHashCode(call) + index; }
        @Override public String toString() { return StackSlots.toString(this); }
    }

    /** Return label pushed for a call to a user function. */
    final class FunctionCallReturnLabelSlot implements StackSlot {
        public final Ast.FunctionCall call;

        public FunctionCallReturnLabelSlot(Ast.FunctionCall call) { this.call = Objects.requireNonNull(call); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitFunctionCallReturnLabel(this); }
        @Override public boolean equals(Object o) {
            return o instanceof FunctionCallReturnLabelSlot && ((FunctionCallReturnLabelSlot) o).call == call;
        }
        @Override public int hashCode() { return System.identityHashCode(call); }
        @Override public String toString() { return StackSlots.toString(this); }
    }

    /** Return label of the function currently being executed. */
    final class FunctionReturnLabelSlot implements StackSlot {
        public final Ast.YulFunction function;

        public FunctionReturnLabelSlot(Ast.YulFunction function) { this.function = Objects.requireNonNull(function); }

        @Override public <R> R accept(Visitor<R> v) { return v.visitFunctionReturnLabel(this); }
        @Override public boolean equals(Object o) {
            return o instanceof FunctionReturnLabelSlot && ((FunctionReturnLabelSlot) o).function == function;
        }
        @Override public int hashCode() { return System.identityHashCode(function); }
        @Override public String toString() { return StackSlots.toString(this); }
    }

    final class JunkSlot implements StackSlot {
        public static final JunkSlot INSTANCE = new JunkSlot();

        private JunkSlot() {}

        @Override public <R> R accept(Visitor<R> v) { return v.visitJunk(this); }
        @Override public String toString() { return StackSlots.toString(this); }
    }
}

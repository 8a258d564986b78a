package org.yulcfg;

import java.math.BigInteger;
import java.util.List;

/**
 * Canonical textual rendering of stack slots, shared by the JSON exporter and debug output.
 */
public final class StackSlots {
    private StackSlots() {}

    /** literals up to this value are printed in decimal, larger ones in hex */
    static final BigInteger DECIMAL_LIMIT = BigInteger.valueOf(0x1000000);

    private static final StackSlot.Visitor<String> RENDERER = new StackSlot.Visitor<>() {
        @Override public String visitVariable(StackSlot.VariableSlot slot) {
            return slot.name;
        }

        @Override public String visitLiteral(StackSlot.LiteralSlot slot) {
            return formatNumber(slot.value);
        }

        @Override public String visitTemporary(StackSlot.TemporarySlot slot) {
            return "TMP[" + slot.call.functionName + ", " + slot.index + "]";
        }

        @Override public String visitFunctionCallReturnLabel(StackSlot.FunctionCallReturnLabelSlot slot) {
            return "RET[" + slot.call.functionName + "]";
        }

        @Override public String visitFunctionReturnLabel(StackSlot.FunctionReturnLabelSlot slot) {
            return "RET";
        }

        @Override public String visitJunk(StackSlot.JunkSlot slot) {
            return "JUNK";
        }
    };

    public static String toString(StackSlot slot) {
        return slot.accept(RENDERER);
    }

    /** "[ a b c ]" 형태, 빈 스택은 "[ ]" */
    public static String toString(List<? extends StackSlot> stack) {
        StringBuilder sb = new StringBuilder("[ ");
        for (StackSlot slot : stack) {
            sb.append(toString(slot)).append(' ');
        }
        return sb.append(']').toString();
    }

    static String formatNumber(BigInteger value) {
        if (value.compareTo(DECIMAL_LIMIT) <= 0)
            return value.toString();
        return HexUtils.toCompactHexWithPrefix(value);
    }
}

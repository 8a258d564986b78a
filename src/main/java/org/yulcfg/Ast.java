package org.yulcfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CFG 가 참조하는 최소한의 Yul 구문 요소.
 * 호출 지점(call site)의 인자와 함수/빌트인 선언만 다룬다.
 */
public final class Ast {
    private Ast() {}

    public enum LiteralKind { NUMBER, BOOLEAN, STRING }

    /** 식: Literal | Identifier | FunctionCall */
    public interface Expression {}

    public static final class Literal implements Expression {
        public final LiteralKind kind;
        public final String value;   // 소스에 적힌 그대로, e.g. "5", "true", "runtime"

        public Literal(LiteralKind kind, String value) {
            this.kind = Objects.requireNonNull(kind);
            this.value = Objects.requireNonNull(value);
        }

        @Override public String toString() { return value; }
    }

    public static final class Identifier implements Expression {
        public final String name;

        public Identifier(String name) { this.name = Objects.requireNonNull(name); }

        @Override public String toString() { return name; }
    }

    public static final class FunctionCall implements Expression {
        public final String functionName;
        public final List<Expression> arguments;

        public FunctionCall(String functionName, List<? extends Expression> arguments) {
            this.functionName = Objects.requireNonNull(functionName);
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override public String toString() { return functionName + arguments; }
    }

    /** 사용자 정의 함수 (scope 의 function entry) */
    public static final class YulFunction {
        public final String name;
        public final int numArguments;
        public final int numReturns;

        public YulFunction(String name, int numArguments, int numReturns) {
            this.name = Objects.requireNonNull(name);
            this.numArguments = numArguments;
            this.numReturns = numReturns;
        }

        @Override public String toString() { return name; }
    }

    /**
     * Builtin declaration. A present entry in {@code literalArguments} marks that
     * parameter position as literal-only.
     */
    public static final class BuiltinFunction {
        public final String name;
        public final List<Optional<LiteralKind>> literalArguments;

        public BuiltinFunction(String name, List<Optional<LiteralKind>> literalArguments) {
            this.name = Objects.requireNonNull(name);
            this.literalArguments = Collections.unmodifiableList(new ArrayList<>(literalArguments));
        }

        public BuiltinFunction(String name) {
            this(name, List.of());
        }

        @Override public String toString() { return name; }
    }
}

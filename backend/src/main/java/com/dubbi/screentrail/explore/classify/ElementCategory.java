package com.dubbi.screentrail.explore.classify;

/**
 * 요소 분류 결과. 네 가지 변형만 존재한다.
 */
public sealed interface ElementCategory {
    enum Kind {
        SAFE_ACTIONABLE,
        DANGEROUS,
        TEXT_INPUT,
        LOGIN_GATE
    }

    Kind kind();

    /** 로그/API용 짧은 이름 */
    default String label() {
        return switch (kind()) {
            case SAFE_ACTIONABLE -> "safe";
            case DANGEROUS -> "dangerous:" + ((Dangerous) this).reason();
            case TEXT_INPUT -> ((TextInput) this).masked() ? "masked-input" : "input";
            case LOGIN_GATE -> "login-gate";
        };
    }

    record SafeActionable() implements ElementCategory {
        @Override
        public Kind kind() {
            return Kind.SAFE_ACTIONABLE;
        }
    }

    record Dangerous(String reason, String matchedPattern) implements ElementCategory {
        @Override
        public Kind kind() {
            return Kind.DANGEROUS;
        }
    }

    record TextInput(boolean masked) implements ElementCategory {
        @Override
        public Kind kind() {
            return Kind.TEXT_INPUT;
        }
    }

    record LoginGate(int signals) implements ElementCategory {
        @Override
        public Kind kind() {
            return Kind.LOGIN_GATE;
        }
    }
}

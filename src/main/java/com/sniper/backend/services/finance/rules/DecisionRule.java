package com.sniper.backend.services.finance.rules;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Uma linha da tabela de decisão: condição sobre o contexto e o resultado produzido quando ela casa.
 */
public record DecisionRule<C, O>(
        String name,
        Predicate<C> condition,
        Function<C, O> outcome
) {
    public DecisionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(outcome, "outcome");
    }

    public static <C, O> DecisionRule<C, O> when(String name, Predicate<C> condition, Function<C, O> outcome) {
        return new DecisionRule<>(name, condition, outcome);
    }

    public static <C, O> DecisionRule<C, O> otherwise(String name, Function<C, O> outcome) {
        return new DecisionRule<>(name, ctx -> true, outcome);
    }

    public boolean matches(C context) {
        return condition.test(context);
    }
}

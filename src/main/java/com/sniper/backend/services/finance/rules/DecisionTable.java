package com.sniper.backend.services.finance.rules;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Lista ordenada de regras avaliada de cima para baixo; a primeira que casa decide.
 *
 * A ordem é parte da semântica (ex: desconto à vista antes de parcelamento) e nunca é
 * reordenada. A última regra deve ser um {@link DecisionRule#otherwise}.
 */
@Slf4j
public final class DecisionTable<C, O> {

    private final String name;
    private final List<DecisionRule<C, O>> rules;

    private DecisionTable(String name, List<DecisionRule<C, O>> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Tabela de decisão '" + name + "' sem regras");
        }
        this.name = name;
        this.rules = List.copyOf(rules);
    }

    @SafeVarargs
    public static <C, O> DecisionTable<C, O> of(String name, DecisionRule<C, O>... rules) {
        return new DecisionTable<>(name, List.of(rules));
    }

    public O evaluate(C context) {
        return match(context).outcome().apply(context);
    }

    public DecisionRule<C, O> match(C context) {
        for (DecisionRule<C, O> rule : rules) {
            if (rule.matches(context)) {
                log.debug("[DecisionTable:{}] rule={}", name, rule.name());
                return rule;
            }
        }
        throw new IllegalStateException("Nenhuma regra da tabela '" + name + "' casou com o contexto");
    }

    public List<String> ruleNames() {
        return rules.stream().map(DecisionRule::name).toList();
    }
}

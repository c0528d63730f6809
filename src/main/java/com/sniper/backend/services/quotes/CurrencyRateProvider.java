package com.sniper.backend.services.quotes;

/**
 * Fonte externa da cotação do dólar.
 *
 * Implementações nunca lançam exceção para o chamador: em qualquer falha de rede ou
 * de parsing devolvem a cotação de fallback com o horário local atual.
 */
public interface CurrencyRateProvider {

    CurrencyQuote getCurrentRate();
}

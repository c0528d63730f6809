package com.sniper.backend.services.finance;

import java.math.BigDecimal;

import org.springframework.stereotype.Service;

import com.sniper.backend.config.ImportTaxProperties;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.ImportRecommendation;
import com.sniper.backend.services.finance.model.ImportAnalysis;
import com.sniper.backend.services.finance.model.ImportComparison;
import com.sniper.backend.services.finance.model.ImportCostBreakdown;
import com.sniper.backend.services.quotes.CurrencyQuote;
import com.sniper.backend.services.quotes.CurrencyRateProvider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Custo de importação brasileiro (Remessa Conforme + ICMS "por fora").
 *
 * <pre>
 * base      = (preço + frete) * cotação
 * II        = base * 20% (até US$ 50 no Remessa Conforme) ou 60%
 * subtotal  = base + II
 * ICMS      = subtotal * 17%
 * total     = subtotal + ICMS
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportCostCalculator {

    private final ImportTaxProperties taxes;
    private final CurrencyRateProvider currencyRateProvider;

    public ImportCostBreakdown calculate(BigDecimal priceUsd, BigDecimal shippingUsd, boolean remessaConforme) {
        return calculate(priceUsd, shippingUsd, remessaConforme, currencyRateProvider.getCurrentRate());
    }

    public ImportCostBreakdown calculate(BigDecimal priceUsd, BigDecimal shippingUsd, boolean remessaConforme, CurrencyQuote quote) {
        BigDecimal price = FinanceValidation.requireNonNegative(priceUsd, "Preço em dólar");
        BigDecimal shipping = FinanceValidation.nonNegativeOrZero(shippingUsd, "Frete em dólar");

        BigDecimal totalUsd = price.add(shipping);
        BigDecimal rate = quote.rate();
        BigDecimal baseBrl = totalUsd.multiply(rate);

        BigDecimal importTaxRate = importTaxRate(totalUsd, remessaConforme);
        BigDecimal importTax = baseBrl.multiply(importTaxRate);
        BigDecimal subtotal = baseBrl.add(importTax);
        BigDecimal icms = subtotal.multiply(taxes.icmsRate());
        BigDecimal total = subtotal.add(icms);

        log.debug("[ImportCost] totalUsd={} rate={} taxRate={} totalBrl={}", totalUsd, rate, importTaxRate, total);

        return ImportCostBreakdown.builder()
                .priceUsd(price)
                .shippingUsd(shipping)
                .totalUsd(totalUsd)
                .dollarRate(rate)
                .rateTimestamp(quote.asOf())
                .rateFallback(quote.fallback())
                .baseBrl(MoneyUtils.money(baseBrl))
                .importTaxRate(importTaxRate(totalUsd, remessaConforme))
                .importTaxBrl(MoneyUtils.money(importTax))
                .subtotalBrl(MoneyUtils.money(subtotal))
                .icmsRate(taxes.icmsRate())
                .icmsBrl(MoneyUtils.money(icms))
                .totalBrl(MoneyUtils.money(total))
                .remessaConforme(remessaConforme)
                .sourceCurrency(Currency.USD)
                .targetCurrency(Currency.BRL)
                .build();
    }

    /**
     * Compara o total importado (já arredondado) com o preço nacional.
     * Diferença positiva favorece importar; negativa, comprar no Brasil.
     */
    public ImportComparison compareAgainstDomesticPrice(BigDecimal domesticPrice, ImportCostBreakdown breakdown) {
        BigDecimal national = FinanceValidation.requireNonNegative(domesticPrice, "Preço nacional");
        BigDecimal importTotal = breakdown.totalBrl();

        BigDecimal difference = national.subtract(importTotal);
        BigDecimal percentageDiff = MoneyUtils.percentageOf(difference, national, BigDecimal.ZERO);

        ImportRecommendation recommendation;
        BigDecimal savings;
        String text;
        if (difference.signum() > 0) {
            recommendation = ImportRecommendation.IMPORT;
            savings = difference;
            text = String.format("Importar é mais barato. Economia de %s (%s)",
                    MoneyUtils.formatBrl(savings), MoneyUtils.formatPercent(percentageDiff));
        } else if (difference.signum() < 0) {
            recommendation = ImportRecommendation.DOMESTIC;
            savings = difference.abs();
            text = String.format("Comprar no Brasil é mais barato. Economia de %s (%s)",
                    MoneyUtils.formatBrl(savings), MoneyUtils.formatPercent(percentageDiff.abs()));
        } else {
            recommendation = ImportRecommendation.EQUAL;
            savings = BigDecimal.ZERO;
            text = "Preços equivalentes. Considere o prazo de entrega.";
        }

        return ImportComparison.builder()
                .importAnalysis(breakdown)
                .nationalPriceBrl(national)
                .priceDifference(MoneyUtils.money(difference))
                .percentageDifference(MoneyUtils.percent(percentageDiff))
                .recommendation(recommendation)
                .recommendationText(text)
                .savings(MoneyUtils.money(savings))
                .currency(Currency.BRL)
                .build();
    }

    /** Preço nacional ausente ou zero significa "sem comparação". */
    public ImportAnalysis analyze(BigDecimal priceUsd, BigDecimal shippingUsd, BigDecimal domesticPrice, boolean remessaConforme) {
        ImportCostBreakdown breakdown = calculate(priceUsd, shippingUsd, remessaConforme);
        if (domesticPrice == null || domesticPrice.signum() == 0) {
            return new ImportAnalysis(breakdown, null);
        }
        return new ImportAnalysis(breakdown, compareAgainstDomesticPrice(domesticPrice, breakdown));
    }

    /**
     * Alíquota do imposto de importação. Reavaliada sempre que pedida (cálculo e campo de saída)
     * em vez de propagada, para que ambos dependam só de (total, programa).
     */
    BigDecimal importTaxRate(BigDecimal totalUsd, boolean remessaConforme) {
        if (remessaConforme && totalUsd.compareTo(taxes.reducedTaxThresholdUsd()) <= 0) {
            return taxes.reducedImportTaxRate();
        }
        return taxes.standardImportTaxRate();
    }
}

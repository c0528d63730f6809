package com.sniper.backend.services.finance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.ProjectType;
import com.sniper.backend.services.finance.model.BudgetAlert;
import com.sniper.backend.services.finance.model.ProjectItem;
import com.sniper.backend.services.finance.model.ProjectItemSummary;
import com.sniper.backend.services.finance.model.ProjectSummary;

/**
 * Totais de um projeto de compra (lista de itens) frente ao orçamento mensal.
 */
@Service
public class ProjectBudgetCalculator {

    public ProjectSummary summarize(String name, ProjectType projectType, List<ProjectItem> items, BigDecimal monthlyBudget) {
        BigDecimal budget = FinanceValidation.nonNegativeOrZero(monthlyBudget, "Orçamento mensal");
        List<ProjectItem> safeItems = items == null ? List.of() : items;

        BigDecimal totalCash = BigDecimal.ZERO;
        BigDecimal totalInstallment = BigDecimal.ZERO;
        BigDecimal totalMonthly = BigDecimal.ZERO;
        List<ProjectItemSummary> summaries = new ArrayList<>(safeItems.size());

        for (ProjectItem item : safeItems) {
            BigDecimal quantity = BigDecimal.valueOf(item.quantity());
            BigDecimal itemCash = item.cashPrice().multiply(quantity);
            BigDecimal itemInstallment = item.installmentPrice().multiply(quantity);
            BigDecimal itemMonthly = itemInstallment.divide(BigDecimal.valueOf(item.installmentCount()), MoneyUtils.MATH);
            BigDecimal itemSavings = itemInstallment.subtract(itemCash);

            summaries.add(ProjectItemSummary.builder()
                    .name(item.name())
                    .store(item.store())
                    .quantity(item.quantity())
                    .totalCashPrice(MoneyUtils.money(itemCash))
                    .totalInstallmentPrice(MoneyUtils.money(itemInstallment))
                    .monthlyInstallment(MoneyUtils.money(itemMonthly))
                    .savingsIfCash(MoneyUtils.money(itemSavings))
                    .hasSavings(itemSavings.signum() > 0)
                    .build());

            totalCash = totalCash.add(itemCash);
            totalInstallment = totalInstallment.add(itemInstallment);
            totalMonthly = totalMonthly.add(itemMonthly);
        }

        boolean overBudget = budget.signum() > 0 && totalMonthly.compareTo(budget) > 0;

        return ProjectSummary.builder()
                .name(name)
                .projectType(projectType == null ? ProjectType.OUTRO : projectType)
                .items(List.copyOf(summaries))
                .totalCashPrice(MoneyUtils.money(totalCash))
                .totalInstallmentPrice(MoneyUtils.money(totalInstallment))
                .totalMonthlyInstallment(MoneyUtils.money(totalMonthly))
                .savingsIfCash(MoneyUtils.money(totalInstallment.subtract(totalCash)))
                .monthlyBudget(MoneyUtils.money(budget))
                .overBudget(overBudget)
                .budgetPercentageUsed(MoneyUtils.percent(MoneyUtils.percentageOf(totalMonthly, budget, BigDecimal.ZERO)))
                .budgetAlert(overBudget ? alert(totalMonthly, budget) : BudgetAlert.none())
                .currency(Currency.BRL)
                .build();
    }

    private static BudgetAlert alert(BigDecimal monthly, BigDecimal budget) {
        String message = "Atenção: A parcela mensal (" + MoneyUtils.formatBrl(monthly)
                + ") excede seu orçamento (" + MoneyUtils.formatBrl(budget) + ")";
        return new BudgetAlert(true, message, MoneyUtils.money(monthly.subtract(budget)));
    }
}

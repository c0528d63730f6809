package com.sniper.backend.services.finance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.sniper.backend.enums.ProjectType;
import com.sniper.backend.exceptions.BadRequestException;
import com.sniper.backend.services.finance.model.ProjectItem;
import com.sniper.backend.services.finance.model.ProjectItemSummary;
import com.sniper.backend.services.finance.model.ProjectSummary;

class ProjectBudgetCalculatorTest {

    private final ProjectBudgetCalculator calculator = new ProjectBudgetCalculator();

    @Test
    void summarize_monthlyAboveBudget_raisesAlert() {
        ProjectSummary summary = calculator.summarize("Setup Gamer", ProjectType.PC, setupItems(), new BigDecimal("400"));

        assertEquals(new BigDecimal("2600.00"), summary.totalCashPrice());
        assertEquals(new BigDecimal("2800.00"), summary.totalInstallmentPrice());
        assertEquals(new BigDecimal("420.00"), summary.totalMonthlyInstallment());
        assertEquals(new BigDecimal("200.00"), summary.savingsIfCash());
        assertTrue(summary.overBudget());
        assertEquals(new BigDecimal("105.0"), summary.budgetPercentageUsed());
        assertTrue(summary.budgetAlert().alert());
        assertEquals("Atenção: A parcela mensal (R$ 420,00) excede seu orçamento (R$ 400,00)",
                summary.budgetAlert().message());
        assertEquals(new BigDecimal("20.00"), summary.budgetAlert().difference());
        assertEquals(ProjectType.PC, summary.projectType());
    }

    @Test
    void summarize_itemTotals_multiplyByQuantity() {
        ProjectSummary summary = calculator.summarize("Setup Gamer", ProjectType.PC, setupItems(), new BigDecimal("1000"));

        ProjectItemSummary gpu = summary.items().get(0);
        ProjectItemSummary ram = summary.items().get(1);

        assertEquals(new BigDecimal("220.00"), gpu.monthlyInstallment());
        assertTrue(gpu.hasSavings());
        assertEquals(2, ram.quantity());
        assertEquals(new BigDecimal("600.00"), ram.totalCashPrice());
        assertEquals(new BigDecimal("200.00"), ram.monthlyInstallment());
        assertFalse(ram.hasSavings());
        assertFalse(summary.overBudget());
        assertEquals(new BigDecimal("42.0"), summary.budgetPercentageUsed());
    }

    @Test
    void summarize_withoutBudget_neverOverBudget() {
        ProjectSummary summary = calculator.summarize("Setup Gamer", ProjectType.PC, setupItems(), null);

        assertFalse(summary.overBudget());
        assertEquals(new BigDecimal("0.0"), summary.budgetPercentageUsed());
        assertFalse(summary.budgetAlert().alert());
        assertNull(summary.budgetAlert().message());
    }

    @Test
    void summarize_noItems_returnsZeroTotals() {
        ProjectSummary summary = calculator.summarize("Vazio", null, List.of(), new BigDecimal("500"));

        assertTrue(summary.items().isEmpty());
        assertEquals(new BigDecimal("0.00"), summary.totalMonthlyInstallment());
        assertFalse(summary.overBudget());
        assertEquals(ProjectType.OUTRO, summary.projectType());
    }

    @Test
    void projectItem_zeroQuantity_isRejected() {
        assertThrows(BadRequestException.class, () -> ProjectItem.builder()
                .name("Mouse")
                .cashPrice(new BigDecimal("100"))
                .installmentPrice(new BigDecimal("100"))
                .installmentCount(1)
                .quantity(0)
                .build());
    }

    private static List<ProjectItem> setupItems() {
        return List.of(
                item("Placa de Vídeo", "Kabum", "2000", "2200", 10, 1),
                item("Memória RAM", "Pichau", "300", "300", 3, 2));
    }

    private static ProjectItem item(String name, String store, String cash, String installment, int count, int quantity) {
        return ProjectItem.builder()
                .name(name)
                .store(store)
                .cashPrice(new BigDecimal(cash))
                .installmentPrice(new BigDecimal(installment))
                .installmentCount(count)
                .quantity(quantity)
                .interestFree(true)
                .build();
    }
}

package ch.xavier.crossover.backtesting;

import ch.xavier.crossover.bar.SymbolInfo;
import ch.xavier.crossover.config.ExecutionCostSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionCostModelTest {

    @Test
    void fillPrice_movesAgainstTheTraderByHalfTheSpreadPlusSlippage() {
        ExecutionCostModel costs = new ExecutionCostModel(ExecutionCostSettings.builder()
                .spread(2).slippage(0.5).build(), SymbolInfo.defaults("TEST"));

        assertThat(costs.fillPrice(true, 100)).isEqualTo(101.5);
        assertThat(costs.fillPrice(false, 100)).isEqualTo(98.5);
    }

    @Test
    void roundTripAtAnUnchangedQuote_costsTheFullSpread() {
        ExecutionCostModel costs = new ExecutionCostModel(ExecutionCostSettings.builder().spread(2).build(),
                SymbolInfo.defaults("TEST"));

        assertThat(costs.fillPrice(true, 100) - costs.fillPrice(false, 100)).isEqualTo(2.0);
    }

    @Test
    void symbolSpread_replacesTheConfiguredOne_whenRequested() {
        SymbolInfo symbol = SymbolInfo.defaults("TEST").toBuilder().spread(0.5).build();

        ExecutionCostModel costs = new ExecutionCostModel(ExecutionCostSettings.builder()
                .spread(2).useSymbolSpread(true).build(), symbol);

        assertThat(costs.getSpread()).isEqualTo(0.5);
        assertThat(costs.fillPrice(true, 100)).isEqualTo(100.25);
    }

    @Test
    void commission_isChargedPerLot() {
        ExecutionCostModel costs = new ExecutionCostModel(ExecutionCostSettings.builder().commissionPerLot(7).build(),
                SymbolInfo.defaults("TEST"));

        assertThat(costs.commission(0.5)).isEqualTo(3.5);
    }
}

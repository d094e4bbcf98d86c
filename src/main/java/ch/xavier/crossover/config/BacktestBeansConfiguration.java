package ch.xavier.crossover.config;

import ch.xavier.crossover.bar.SymbolInfo;
import ch.xavier.crossover.bar.SymbolInfoProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BacktestBeansConfiguration {

    /**
     * Used when no broker adapter provides contract specifications.
     */
    @Bean
    @ConditionalOnMissingBean(SymbolInfoProvider.class)
    public SymbolInfoProvider defaultSymbolInfoProvider() {
        return SymbolInfo::defaults;
    }
}
